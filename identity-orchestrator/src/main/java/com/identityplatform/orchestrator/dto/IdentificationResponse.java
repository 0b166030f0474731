package com.identityplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.identityplatform.common.model.Decision;
import com.identityplatform.common.model.ServiceId;

import java.time.Instant;
import java.util.Map;

/**
 * API response of {@code POST /api/v1/identify-and-answer}.
 *
 * <p>{@code answer} carries the chatbot answer only when the decision is MATCH; otherwise it
 * explains why the person was not identified. {@code services} follows the same rule.
 */
public record IdentificationResponse(
    @JsonProperty("requestId")        String requestId,
    @JsonProperty("personIdentified") boolean personIdentified,
    @JsonProperty("answer")           String answer,
    @JsonProperty("confidence")       Double confidence,
    @JsonProperty("personId")         String personId,
    @JsonProperty("decision")         Decision decision,
    @JsonProperty("services")         Map<ServiceId, ServiceOutcomeDTO> services,
    @JsonProperty("processingTimeMs") long processingTimeMs,
    @JsonProperty("timestamp")        Instant timestamp
) {}
