package com.identityplatform.common.fusion;

import com.identityplatform.common.model.Decision;
import com.identityplatform.common.model.FusionConfig;
import com.identityplatform.common.model.FusionMethod;
import com.identityplatform.common.model.VerifierPayload;

/**
 * Comparison strategy applied once a verifier score is available.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no reactive types, no side effects</li>
 *   <li><b>Conservative</b>: disagreement they cannot reconcile resolves to UNKNOWN, never MATCH</li>
 * </ul>
 *
 * <p>Register new implementations with {@link FusionPolicy#withStrategy(FusionStrategy)}.
 */
public interface FusionStrategy {

    FusionMethod method();

    /**
     * @param verifier           successful verifier payload, never {@code null}
     * @param successfulServices number of successful services in the result set
     * @param config             policy parameters
     * @return the non-null {@link Decision}
     */
    Decision evaluate(VerifierPayload verifier, int successfulServices, FusionConfig config);
}
