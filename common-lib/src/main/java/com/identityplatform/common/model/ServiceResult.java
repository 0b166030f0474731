package com.identityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one external call.
 *
 * <p>{@code payload} is present if and only if {@code status} is {@link ServiceStatus#SUCCESS}.
 * {@code errorDetail} is diagnostic text for logs and traces; fusion never reads it.
 */
public record ServiceResult(
    @JsonProperty("serviceId")   ServiceId serviceId,
    @JsonProperty("status")      ServiceStatus status,
    @JsonProperty("payload")     ServicePayload payload,
    @JsonIgnore                  Duration latency,
    @JsonProperty("errorDetail") String errorDetail
) {

    public ServiceResult {
        Objects.requireNonNull(serviceId, "serviceId");
        Objects.requireNonNull(status, "status");
        if ((status == ServiceStatus.SUCCESS) != (payload != null)) {
            throw new IllegalArgumentException(
                "payload must be present iff status is SUCCESS. service=" + serviceId + " status=" + status);
        }
        latency = latency != null ? latency : Duration.ZERO;
    }

    public static ServiceResult success(ServiceId serviceId, ServicePayload payload, Duration latency) {
        return new ServiceResult(serviceId, ServiceStatus.SUCCESS, payload, latency, null);
    }

    public static ServiceResult timeout(ServiceId serviceId, Duration latency, String detail) {
        return new ServiceResult(serviceId, ServiceStatus.TIMEOUT, null, latency, detail);
    }

    public static ServiceResult transportError(ServiceId serviceId, Duration latency, String detail) {
        return new ServiceResult(serviceId, ServiceStatus.TRANSPORT_ERROR, null, latency, detail);
    }

    public static ServiceResult invalidResponse(ServiceId serviceId, Duration latency, String detail) {
        return new ServiceResult(serviceId, ServiceStatus.INVALID_RESPONSE, null, latency, detail);
    }

    @Override
    @JsonIgnore
    public Duration latency() {
        return latency;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ServiceStatus.SUCCESS;
    }

    @JsonProperty("latencyMs")
    public long latencyMs() {
        return latency.toMillis();
    }

    /**
     * Returns the payload narrowed to {@code type}, or {@code null} when the call failed
     * or carried a different payload type.
     */
    public <T extends ServicePayload> T payloadAs(Class<T> type) {
        return type.isInstance(payload) ? type.cast(payload) : null;
    }
}
