package com.identityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable policy parameters for one fusion.
 *
 * <p>{@code threshold + margin} may exceed 1. The match bound is not clamped, so under
 * {@link FusionMethod#DELTA} a saturated config never yields MATCH.
 *
 * @param threshold minimum verifier confidence for a positive match, in [0, 1]
 * @param margin    gap above {@code threshold} required to avoid an ambiguous outcome, &ge; 0
 * @param method    comparison strategy
 */
public record FusionConfig(
    @JsonProperty("threshold") double threshold,
    @JsonProperty("margin")    double margin,
    @JsonProperty("method")    FusionMethod method
) {

    public FusionConfig {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0, 1], got " + threshold);
        }
        if (Double.isNaN(margin) || Double.isInfinite(margin) || margin < 0.0) {
            throw new IllegalArgumentException("margin must be >= 0, got " + margin);
        }
        Objects.requireNonNull(method, "method");
    }

    public static FusionConfig delta(double threshold, double margin) {
        return new FusionConfig(threshold, margin, FusionMethod.DELTA);
    }

    /** Lower edge of the MATCH region under {@link FusionMethod#DELTA}. */
    public double matchBound() {
        return threshold + margin;
    }

    public boolean isSaturated() {
        return matchBound() > 1.0;
    }

    /**
     * Returns a copy with any non-null override applied. Validation runs again on the result.
     */
    public FusionConfig withOverrides(Double threshold, Double margin, FusionMethod method) {
        return new FusionConfig(
            threshold != null ? threshold : this.threshold,
            margin    != null ? margin    : this.margin,
            method    != null ? method    : this.method);
    }
}
