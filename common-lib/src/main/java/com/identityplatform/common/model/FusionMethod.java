package com.identityplatform.common.model;

import java.util.Locale;

/**
 * Comparison strategy applied to the verifier score.
 *
 * <ul>
 *   <li>{@link #DELTA}: threshold plus a margin band that yields UNKNOWN</li>
 *   <li>{@link #TAU}: plain threshold vote, conservative when the verifier's own verdict disagrees</li>
 * </ul>
 */
public enum FusionMethod {
    DELTA,
    TAU;

    /**
     * Case-insensitive lookup used for request overrides and configuration values.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static FusionMethod fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("fusion method must not be blank");
        }
        try {
            return FusionMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown fusion method: " + value, e);
        }
    }
}
