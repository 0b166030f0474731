package com.identityplatform.orchestrator.analytics;

import java.time.Duration;
import java.util.Arrays;

/**
 * Look-back windows accepted by the analytics endpoints.
 */
public enum TimeRange {
    LAST_HOUR("1h", Duration.ofHours(1)),
    LAST_DAY("24h", Duration.ofHours(24)),
    LAST_WEEK("7d", Duration.ofDays(7)),
    LAST_MONTH("30d", Duration.ofDays(30));

    private final String label;
    private final Duration duration;

    TimeRange(String label, Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    public String label() {
        return label;
    }

    public Duration duration() {
        return duration;
    }

    /** Unknown or missing labels fall back to {@link #LAST_DAY}. */
    public static TimeRange fromLabel(String label) {
        if (label == null) return LAST_DAY;
        String trimmed = label.trim();
        return Arrays.stream(values())
            .filter(range -> range.label.equalsIgnoreCase(trimmed))
            .findFirst()
            .orElse(LAST_DAY);
    }
}
