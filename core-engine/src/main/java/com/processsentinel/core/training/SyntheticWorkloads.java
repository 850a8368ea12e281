package com.processsentinel.core.training;

import com.processsentinel.core.classification.LabeledSample;
import com.processsentinel.core.classification.WorkloadLabels;
import com.processsentinel.core.model.Sample;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Generates labeled samples from fixed workload archetypes, used to bootstrap
 * the classifier before real labeled data exists.
 *
 * <p>
 * Each archetype draws every metric uniformly from its own range. The ranges
 * and priorities differ enough between archetypes for a tree ensemble to
 * separate them.
 * </p>
 *
 * @since 1.0.0
 */
public final class SyntheticWorkloads {

    private static final Map<String, Archetype> ARCHETYPES = new LinkedHashMap<>();

    static {
        ARCHETYPES.put(WorkloadLabels.WEB_SERVER, new Archetype(10,
                10, 40, 200, 500, 50, 150, 100, 300, 50, 150, 500, 1500, 1000, 3000));
        ARCHETYPES.put(WorkloadLabels.DATABASE, new Archetype(15,
                15, 55, 500, 1000, 100, 300, 1000, 3000, 500, 1500, 200, 500, 300, 800));
        ARCHETYPES.put(WorkloadLabels.ML_TRAINING, new Archetype(5,
                60, 95, 800, 2000, 10, 40, 500, 1000, 200, 500, 50, 150, 50, 150));
        ARCHETYPES.put(WorkloadLabels.CACHE, new Archetype(12,
                5, 20, 1000, 3000, 4, 16, 10, 60, 10, 60, 2000, 5000, 2000, 5000));
        ARCHETYPES.put(WorkloadLabels.SYSTEM, new Archetype(20,
                0, 5, 5, 50, 1, 8, 0, 20, 0, 20, 0, 10, 0, 10));
        ARCHETYPES.put(WorkloadLabels.APPLICATION, new Archetype(0,
                5, 30, 100, 400, 10, 50, 50, 200, 20, 100, 100, 400, 100, 400));
    }

    private SyntheticWorkloads() {
        // utility class - not instantiable
    }

    /**
     * @param perLabel samples per archetype
     * @param random   value source
     * @return samples for every known label, grouped by label
     */
    public static List<LabeledSample> generate(int perLabel, Random random) {
        return generate(WorkloadLabels.ALL, perLabel, random);
    }

    /**
     * @param labels   archetypes to draw from
     * @param perLabel samples per archetype
     * @param random   value source
     * @return generated samples, grouped by label in the order given
     * @throws IllegalArgumentException for a label without an archetype
     */
    public static List<LabeledSample> generate(List<String> labels, int perLabel, Random random) {
        Objects.requireNonNull(labels, "labels must not be null");
        Objects.requireNonNull(random, "random must not be null");
        List<LabeledSample> samples = new ArrayList<>(labels.size() * Math.max(perLabel, 0));
        for (String label : labels) {
            Archetype archetype = ARCHETYPES.get(label);
            if (archetype == null) {
                throw new IllegalArgumentException("No archetype for label: '" + label + "'");
            }
            for (int i = 0; i < perLabel; i++) {
                samples.add(new LabeledSample(archetype.draw(label + "-" + i, random), label));
            }
        }
        return samples;
    }

    private static final class Archetype {
        private final int priority;
        private final double[] ranges;

        Archetype(int priority, double... ranges) {
            this.priority = priority;
            this.ranges = ranges;
        }

        Sample draw(String processId, Random random) {
            return Sample.builder(processId)
                    .processName(processId)
                    .priority(priority)
                    .cpu(uniform(random, 0))
                    .memory(uniform(random, 1))
                    .threads(uniform(random, 2))
                    .metric(Sample.IO_READ, uniform(random, 3))
                    .metric(Sample.IO_WRITE, uniform(random, 4))
                    .metric(Sample.NETWORK_SENT, uniform(random, 5))
                    .metric(Sample.NETWORK_RECEIVED, uniform(random, 6))
                    .build();
        }

        private double uniform(Random random, int metric) {
            double low = ranges[2 * metric];
            double high = ranges[2 * metric + 1];
            return low + random.nextDouble() * (high - low);
        }
    }
}
