package com.identityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Final fusion output. Created once per orchestration request and never modified.
 *
 * @param outcome            fused verdict
 * @param successfulServices number of services that answered with {@link ServiceStatus#SUCCESS}
 * @param reason             why this outcome was chosen
 * @param confidence         verifier score the decision was based on; {@code null} without a verifier answer
 */
public record Decision(
    @JsonProperty("outcome")            DecisionOutcome outcome,
    @JsonProperty("successfulServices") int successfulServices,
    @JsonProperty("reason")             DecisionReason reason,
    @JsonProperty("confidence")         Double confidence
) {

    public Decision {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(reason, "reason");
        if (successfulServices < 0) {
            throw new IllegalArgumentException("successfulServices must be >= 0");
        }
    }

    public static Decision match(int successfulServices, double confidence) {
        return new Decision(DecisionOutcome.MATCH, successfulServices, DecisionReason.CONFIDENT_MATCH, confidence);
    }

    public static Decision noMatch(int successfulServices, double confidence) {
        return new Decision(DecisionOutcome.NO_MATCH, successfulServices, DecisionReason.BELOW_THRESHOLD, confidence);
    }

    public static Decision unknown(int successfulServices, DecisionReason reason, Double confidence) {
        return new Decision(DecisionOutcome.UNKNOWN, successfulServices, reason, confidence);
    }

    @JsonIgnore
    public boolean isMatch() {
        return outcome == DecisionOutcome.MATCH;
    }
}
