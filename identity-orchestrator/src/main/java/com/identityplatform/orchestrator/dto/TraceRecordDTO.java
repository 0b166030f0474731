package com.identityplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDateTime;

/**
 * API view of a persisted trace. {@code resultSet} is the stored JSON snapshot, re-parsed.
 */
public record TraceRecordDTO(
    @JsonProperty("requestId")          String requestId,
    @JsonProperty("recordedAt")         LocalDateTime recordedAt,
    @JsonProperty("query")              String query,
    @JsonProperty("provider")           String provider,
    @JsonProperty("imageFilename")      String imageFilename,
    @JsonProperty("outcome")            String outcome,
    @JsonProperty("reason")             String reason,
    @JsonProperty("successfulServices") Integer successfulServices,
    @JsonProperty("confidence")         Double confidence,
    @JsonProperty("personId")           String personId,
    @JsonProperty("answer")             String answer,
    @JsonProperty("resultSet")          JsonNode resultSet,
    @JsonProperty("threshold")          Double threshold,
    @JsonProperty("margin")             Double margin,
    @JsonProperty("fusionMethod")       String fusionMethod,
    @JsonProperty("processingTimeMs")   Long processingTimeMs
) {}
