package com.identityplatform.orchestrator.support;

import com.identityplatform.common.model.ChatbotPayload;
import com.identityplatform.common.model.IdentificationRequest;
import com.identityplatform.common.model.ServiceId;
import com.identityplatform.common.model.ServiceResult;
import com.identityplatform.common.model.VerifierPayload;
import com.identityplatform.orchestrator.model.IdentificationTrace;

import java.time.Duration;
import java.time.LocalDateTime;

public final class Fixtures {

    private Fixtures() {}

    public static IdentificationRequest request() {
        return new IdentificationRequest(new byte[] {1, 2, 3}, "face.jpg",
            "Which article regulates attendance?", null, null);
    }

    public static ServiceResult verifierSuccess(double confidence) {
        return ServiceResult.success(ServiceId.VERIFIER,
            new VerifierPayload(confidence, "p-42", null), Duration.ofMillis(120));
    }

    public static ServiceResult chatbotSuccess(String answer) {
        return ServiceResult.success(ServiceId.CHATBOT,
            new ChatbotPayload(answer, "deepseek"), Duration.ofMillis(340));
    }

    public static IdentificationTrace trace(String requestId, LocalDateTime recordedAt, String outcome,
                                            Double confidence, String verifierStatus, String chatbotStatus,
                                            long processingTimeMs) {
        IdentificationTrace trace = new IdentificationTrace();
        trace.setRequestId(requestId);
        trace.setRecordedAt(recordedAt);
        trace.setOutcome(outcome);
        trace.setConfidence(confidence);
        trace.setVerifierStatus(verifierStatus);
        trace.setVerifierLatencyMs(verifierStatus != null ? 100L : null);
        trace.setChatbotStatus(chatbotStatus);
        trace.setChatbotLatencyMs(chatbotStatus != null ? 300L : null);
        trace.setProcessingTimeMs(processingTimeMs);
        return trace;
    }
}
