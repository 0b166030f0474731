package com.identityplatform.orchestrator.dispatch;

import com.identityplatform.common.model.ServiceId;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The two timeout scopes of a dispatch: one per service, enforced inside each client, and the
 * overall deadline, enforced by the dispatcher. The overall deadline may be shorter than any
 * per-service timeout.
 */
public record DispatchTimeouts(Map<ServiceId, Duration> perService, Duration overallDeadline) {

    public DispatchTimeouts {
        Objects.requireNonNull(overallDeadline, "overallDeadline");
        requirePositive("overallDeadline", overallDeadline);
        EnumMap<ServiceId, Duration> copy = new EnumMap<>(ServiceId.class);
        for (ServiceId id : ServiceId.values()) {
            Duration timeout = perService.get(id);
            if (timeout == null) {
                throw new IllegalArgumentException("missing timeout for service " + id);
            }
            requirePositive(id + " timeout", timeout);
            copy.put(id, timeout);
        }
        perService = Collections.unmodifiableMap(copy);
    }

    public static DispatchTimeouts of(Duration verifierTimeout, Duration chatbotTimeout, Duration overallDeadline) {
        return new DispatchTimeouts(
            Map.of(ServiceId.VERIFIER, verifierTimeout, ServiceId.CHATBOT, chatbotTimeout),
            overallDeadline);
    }

    public Duration forService(ServiceId serviceId) {
        return perService.get(serviceId);
    }

    private static void requirePositive(String name, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
