package com.identityplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.identityplatform.common.model.Decision;
import com.identityplatform.common.model.ResultSet;
import com.identityplatform.common.model.ServiceId;
import com.identityplatform.common.model.ServicePayload;
import com.identityplatform.common.model.ServiceResult;
import com.identityplatform.common.model.ServiceStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-service outcome as exposed to callers and stored with a trace.
 *
 * <p>The chatbot payload is disclosed only for a MATCH decision; otherwise only its status and
 * latency are kept.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceOutcomeDTO(
    @JsonProperty("status")      ServiceStatus status,
    @JsonProperty("latencyMs")   long latencyMs,
    @JsonProperty("errorDetail") String errorDetail,
    @JsonProperty("payload")     ServicePayload payload
) {

    public static Map<ServiceId, ServiceOutcomeDTO> disclosed(ResultSet resultSet, Decision decision) {
        EnumMap<ServiceId, ServiceOutcomeDTO> outcomes = new EnumMap<>(ServiceId.class);
        resultSet.asMap().forEach((serviceId, result) ->
            outcomes.put(serviceId, of(result, serviceId != ServiceId.CHATBOT || decision.isMatch())));
        return Collections.unmodifiableMap(outcomes);
    }

    private static ServiceOutcomeDTO of(ServiceResult result, boolean withPayload) {
        return new ServiceOutcomeDTO(result.status(), result.latencyMs(), result.errorDetail(),
                                     withPayload ? result.payload() : null);
    }
}
