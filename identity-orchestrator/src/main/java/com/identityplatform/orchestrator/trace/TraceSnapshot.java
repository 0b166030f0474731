package com.identityplatform.orchestrator.trace;

import com.identityplatform.common.model.Decision;
import com.identityplatform.common.model.FusionConfig;
import com.identityplatform.common.model.IdentificationRequest;
import com.identityplatform.common.model.ResultSet;

import java.time.Instant;

/**
 * Everything the recorder persists for one request, captured after fusion.
 * {@code answer} is the text returned to the caller.
 */
public record TraceSnapshot(
    String requestId,
    Instant recordedAt,
    IdentificationRequest request,
    ResultSet resultSet,
    Decision decision,
    FusionConfig config,
    String answer,
    long processingTimeMs
) {}
