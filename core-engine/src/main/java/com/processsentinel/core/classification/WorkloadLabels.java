package com.processsentinel.core.classification;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The fixed set of workload labels a process can be classified as.
 *
 * @since 1.0.0
 */
public final class WorkloadLabels {

    public static final String WEB_SERVER = "web-server";
    public static final String DATABASE = "database";
    public static final String APPLICATION = "application";
    public static final String CACHE = "cache";
    public static final String ML_TRAINING = "ml-training";
    public static final String SYSTEM = "system";

    /** All labels, in class-index order. */
    public static final List<String> ALL = Collections.unmodifiableList(
            Arrays.asList(WEB_SERVER, DATABASE, APPLICATION, CACHE, ML_TRAINING, SYSTEM));

    private WorkloadLabels() {
        // utility class - not instantiable
    }

    public static boolean isKnown(String label) {
        return ALL.contains(label);
    }
}
