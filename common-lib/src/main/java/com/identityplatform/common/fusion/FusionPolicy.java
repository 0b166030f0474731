package com.identityplatform.common.fusion;

import com.identityplatform.common.model.Decision;
import com.identityplatform.common.model.DecisionReason;
import com.identityplatform.common.model.FusionConfig;
import com.identityplatform.common.model.FusionMethod;
import com.identityplatform.common.model.ResultSet;
import com.identityplatform.common.model.ServiceId;
import com.identityplatform.common.model.ServiceResult;
import com.identityplatform.common.model.VerifierPayload;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Combines the results collected for one request into a single {@link Decision}.
 *
 * <p>Deterministic and free of I/O: identical inputs always produce an equal decision.
 *
 * <ol>
 *   <li>No successful service at all → UNKNOWN (NoSuccessfulServices)</li>
 *   <li>Verifier absent or failed → UNKNOWN (MissingIdentitySignal); a chatbot answer never
 *       substitutes for identity confirmation</li>
 *   <li>Otherwise the {@link FusionStrategy} registered for {@link FusionConfig#method()} decides</li>
 * </ol>
 */
public final class FusionPolicy {

    private final Map<FusionMethod, FusionStrategy> strategies;

    private FusionPolicy(Map<FusionMethod, FusionStrategy> strategies) {
        this.strategies = Collections.unmodifiableMap(strategies);
    }

    /** Policy with every built-in strategy registered. */
    public static FusionPolicy standard() {
        EnumMap<FusionMethod, FusionStrategy> strategies = new EnumMap<>(FusionMethod.class);
        strategies.put(FusionMethod.DELTA, new DeltaFusionStrategy());
        strategies.put(FusionMethod.TAU, new TauFusionStrategy());
        return new FusionPolicy(strategies);
    }

    /** Returns a copy of this policy with {@code strategy} registered for its method. */
    public FusionPolicy withStrategy(FusionStrategy strategy) {
        EnumMap<FusionMethod, FusionStrategy> copy = new EnumMap<>(FusionMethod.class);
        copy.putAll(strategies);
        copy.put(strategy.method(), strategy);
        return new FusionPolicy(copy);
    }

    public Decision fuse(ResultSet resultSet, FusionConfig config) {
        int successful = resultSet.successfulServices();
        if (successful == 0) {
            return Decision.unknown(0, DecisionReason.NO_SUCCESSFUL_SERVICES, null);
        }

        ServiceResult verifierResult = resultSet.get(ServiceId.VERIFIER);
        VerifierPayload verifier = verifierResult != null
            ? verifierResult.payloadAs(VerifierPayload.class)
            : null;
        if (verifier == null) {
            return Decision.unknown(successful, DecisionReason.MISSING_IDENTITY_SIGNAL, null);
        }

        FusionStrategy strategy = strategies.get(config.method());
        if (strategy == null) {
            throw new IllegalStateException("No fusion strategy registered for method " + config.method());
        }
        return strategy.evaluate(verifier, successful, config);
    }
}
