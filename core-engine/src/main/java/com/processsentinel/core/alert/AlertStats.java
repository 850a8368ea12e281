package com.processsentinel.core.alert;

import com.processsentinel.core.model.AlertType;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Alert counts over a trailing time range.
 */
public final class AlertStats {

    private final long total;
    private final Map<AlertType, Long> byType;
    private final long mlDetected;
    private final Duration timeRange;

    public AlertStats(long total, Map<AlertType, Long> byType, long mlDetected, Duration timeRange) {
        this.total = total;
        this.byType = byType.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(byType));
        this.mlDetected = mlDetected;
        this.timeRange = timeRange;
    }

    public long getTotal() {
        return total;
    }

    /** @return counts per type; types with no alerts are absent */
    public Map<AlertType, Long> getByType() {
        return byType;
    }

    public long count(AlertType type) {
        return byType.getOrDefault(type, 0L);
    }

    public long getMlDetected() {
        return mlDetected;
    }

    public Duration getTimeRange() {
        return timeRange;
    }

    @Override
    public String toString() {
        return "AlertStats{total=" + total + ", byType=" + byType + ", mlDetected=" + mlDetected
                + ", timeRange=" + timeRange + '}';
    }
}
