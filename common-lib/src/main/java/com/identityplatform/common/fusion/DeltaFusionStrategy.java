package com.identityplatform.common.fusion;

import com.identityplatform.common.model.Decision;
import com.identityplatform.common.model.DecisionReason;
import com.identityplatform.common.model.FusionConfig;
import com.identityplatform.common.model.FusionMethod;
import com.identityplatform.common.model.VerifierPayload;

/**
 * Reference strategy: compares the verifier score against {@code threshold} and
 * {@code threshold + margin}.
 *
 * <pre>
 *   score &lt; t            → NO_MATCH  (BelowThreshold)
 *   t ≤ score &lt; t + m    → UNKNOWN   (WithinMargin)
 *   score ≥ t + m        → MATCH     (ConfidentMatch)
 * </pre>
 */
public final class DeltaFusionStrategy implements FusionStrategy {

    @Override
    public FusionMethod method() {
        return FusionMethod.DELTA;
    }

    @Override
    public Decision evaluate(VerifierPayload verifier, int successfulServices, FusionConfig config) {
        double score = verifier.confidence();
        if (score < config.threshold()) {
            return Decision.noMatch(successfulServices, score);
        }
        if (score < config.matchBound()) {
            return Decision.unknown(successfulServices, DecisionReason.WITHIN_MARGIN, score);
        }
        return Decision.match(successfulServices, score);
    }
}
