package com.identityplatform.common.fusion;

import com.identityplatform.common.model.Decision;
import com.identityplatform.common.model.DecisionReason;
import com.identityplatform.common.model.FusionConfig;
import com.identityplatform.common.model.FusionMethod;
import com.identityplatform.common.model.VerifierPayload;

/**
 * Threshold vote without a margin band. {@code margin} is ignored.
 *
 * <p>When the verifier reports its own {@code verified} verdict and that verdict disagrees
 * with the threshold vote, the outcome is UNKNOWN (ConflictingSignals).
 */
public final class TauFusionStrategy implements FusionStrategy {

    @Override
    public FusionMethod method() {
        return FusionMethod.TAU;
    }

    @Override
    public Decision evaluate(VerifierPayload verifier, int successfulServices, FusionConfig config) {
        double score = verifier.confidence();
        boolean aboveThreshold = score >= config.threshold();
        Boolean verdict = verifier.verified();

        if (verdict != null && verdict != aboveThreshold) {
            return Decision.unknown(successfulServices, DecisionReason.CONFLICTING_SIGNALS, score);
        }
        return aboveThreshold
            ? Decision.match(successfulServices, score)
            : Decision.noMatch(successfulServices, score);
    }
}
