package com.processsentinel.core.history;

import com.processsentinel.core.model.Sample;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Bounded per-process history of recent samples.
 *
 * <p>
 * Each process gets its own deque of at most {@code capacity} samples; the
 * oldest sample is evicted first. Mutation and reads of one process's buffer
 * are serialized on that buffer, so different processes never contend.
 * </p>
 *
 * @since 1.0.0
 */
public class HistoryStore {

    private final int capacity;
    private final ConcurrentMap<String, Deque<Sample>> buffers = new ConcurrentHashMap<>();

    public HistoryStore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append a sample, evicting the oldest entries beyond capacity.
     *
     * @param processId process key
     * @param sample    sample to append
     */
    public void append(String processId, Sample sample) {
        Objects.requireNonNull(processId, "processId must not be null");
        Objects.requireNonNull(sample, "sample must not be null");
        Deque<Sample> buffer = buffers.computeIfAbsent(processId, k -> new ArrayDeque<>(capacity));
        synchronized (buffer) {
            buffer.addLast(sample);
            while (buffer.size() > capacity) {
                buffer.removeFirst();
            }
        }
    }

    /**
     * @param processId process key
     * @param n         maximum number of samples
     * @return up to {@code n} most recent samples, oldest first
     */
    public List<Sample> window(String processId, int n) {
        Deque<Sample> buffer = buffers.get(processId);
        if (buffer == null || n <= 0) {
            return Collections.emptyList();
        }
        synchronized (buffer) {
            int take = Math.min(n, buffer.size());
            List<Sample> recent = new ArrayList<>(take);
            Iterator<Sample> it = buffer.descendingIterator();
            for (int i = 0; i < take; i++) {
                recent.add(it.next());
            }
            Collections.reverse(recent);
            return recent;
        }
    }

    /**
     * @return the whole retained history of a process, oldest first
     */
    public List<Sample> all(String processId) {
        return window(processId, capacity);
    }

    /**
     * @param processId process key
     * @param metric    metric name, see {@link Sample}
     * @param n         maximum number of points
     * @return one metric over the most recent {@code n} samples, oldest first
     */
    public double[] series(String processId, String metric, int n) {
        List<Sample> recent = window(processId, n);
        double[] values = new double[recent.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = recent.get(i).metric(metric);
        }
        return values;
    }

    public int size(String processId) {
        Deque<Sample> buffer = buffers.get(processId);
        if (buffer == null) {
            return 0;
        }
        synchronized (buffer) {
            return buffer.size();
        }
    }

    public Set<String> processIds() {
        return Collections.unmodifiableSet(buffers.keySet());
    }

    /**
     * Drop a process's history.
     *
     * @return {@code true} if the process had history
     */
    public boolean remove(String processId) {
        return buffers.remove(processId) != null;
    }

    public int getCapacity() {
        return capacity;
    }
}
