package com.identityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Facial verifier answer.
 *
 * @param confidence match confidence in [0, 1]
 * @param personId   identity matched by the verifier, {@code null} when not reported
 * @param verified   the verifier's own verdict, {@code null} when not reported
 */
public record VerifierPayload(
    @JsonProperty("confidence") double confidence,
    @JsonProperty("personId")   String personId,
    @JsonProperty("verified")   Boolean verified
) implements ServicePayload {

    public VerifierPayload {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
    }
}
