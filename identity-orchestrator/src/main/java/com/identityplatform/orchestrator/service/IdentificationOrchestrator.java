package com.identityplatform.orchestrator.service;

import com.identityplatform.common.fusion.FusionPolicy;
import com.identityplatform.common.model.ChatbotPayload;
import com.identityplatform.common.model.Decision;
import com.identityplatform.common.model.FusionConfig;
import com.identityplatform.common.model.IdentificationRequest;
import com.identityplatform.common.model.ResultSet;
import com.identityplatform.common.model.ServiceId;
import com.identityplatform.common.model.ServiceResult;
import com.identityplatform.common.model.VerifierPayload;
import com.identityplatform.common.trace.RequestTraceContext;
import com.identityplatform.orchestrator.dispatch.DispatchTimeouts;
import com.identityplatform.orchestrator.dispatch.ServiceDispatcher;
import com.identityplatform.orchestrator.dto.IdentificationResponse;
import com.identityplatform.orchestrator.dto.ServiceOutcomeDTO;
import com.identityplatform.orchestrator.logger.DecisionFlowLogger;
import com.identityplatform.orchestrator.trace.TraceRecorder;
import com.identityplatform.orchestrator.trace.TraceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Runs one identification request end to end: dispatch both services, fuse their results,
 * hand the trace to the recorder and build the response.
 *
 * <p>Stages run strictly in that order. If the subscriber cancels before the result set is
 * assembled, both client calls are cancelled and neither fusion nor tracing happens.
 */
@Service
public class IdentificationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(IdentificationOrchestrator.class);

    private final ServiceDispatcher dispatcher;
    private final FusionPolicy fusionPolicy;
    private final FusionConfig defaultConfig;
    private final DispatchTimeouts timeouts;
    private final TraceRecorder traceRecorder;
    private final DecisionFlowLogger decisionFlowLogger;
    private final Clock clock;

    public IdentificationOrchestrator(ServiceDispatcher dispatcher,
                                      FusionPolicy fusionPolicy,
                                      FusionConfig defaultConfig,
                                      DispatchTimeouts timeouts,
                                      TraceRecorder traceRecorder,
                                      DecisionFlowLogger decisionFlowLogger,
                                      Clock clock) {
        this.dispatcher = dispatcher;
        this.fusionPolicy = fusionPolicy;
        this.defaultConfig = defaultConfig;
        this.timeouts = timeouts;
        this.traceRecorder = traceRecorder;
        this.decisionFlowLogger = decisionFlowLogger;
        this.clock = clock;
    }

    public FusionConfig defaultConfig() {
        return defaultConfig;
    }

    public Mono<IdentificationResponse> orchestrate(IdentificationRequest request) {
        return orchestrate(request, defaultConfig);
    }

    public Mono<IdentificationResponse> orchestrate(IdentificationRequest request, FusionConfig config) {
        return Mono.defer(() -> {
            final String requestId = RequestTraceContext.newRequestId();
            final long startNanos = System.nanoTime();
            RequestTraceContext.withMdc(requestId, () ->
                log.info("Identification started. image={} bytes={} provider={} method={} requestId={}",
                         request.imageFilename(), request.image().length, request.provider(),
                         config.method(), requestId)
            );

            Mono<IdentificationResponse> pipeline = Mono.just(request)
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.REQUEST_RECEIVED))
                .flatMap(r -> dispatcher.dispatch(r, timeouts))
                .map(resultSet -> {
                    decisionFlowLogger.logResultSet(resultSet, requestId);

                    Decision decision = fusionPolicy.fuse(resultSet, config);
                    decisionFlowLogger.logDecision(decision, config, requestId);

                    long processingTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                    Instant now = clock.instant();
                    String answer = answerFor(decision, resultSet, config);
                    traceRecorder.record(new TraceSnapshot(
                        requestId, now, request, resultSet, decision, config, answer, processingTimeMs));
                    decisionFlowLogger.logWithRequestId(DecisionFlowLogger.TRACE_DISPATCHED, requestId);

                    return buildResponse(requestId, resultSet, decision, answer, processingTimeMs, now);
                })
                .doOnCancel(() ->
                    decisionFlowLogger.logWithRequestId(DecisionFlowLogger.REQUEST_CANCELLED, requestId));

            return RequestTraceContext.withRequestId(pipeline, requestId);
        });
    }

    private IdentificationResponse buildResponse(String requestId, ResultSet resultSet, Decision decision,
                                                 String answer, long processingTimeMs, Instant now) {
        ServiceResult verifier = resultSet.get(ServiceId.VERIFIER);
        VerifierPayload identity = verifier != null ? verifier.payloadAs(VerifierPayload.class) : null;

        return new IdentificationResponse(
            requestId,
            decision.isMatch(),
            answer,
            decision.confidence(),
            identity != null ? identity.personId() : null,
            decision,
            ServiceOutcomeDTO.disclosed(resultSet, decision),
            processingTimeMs,
            now);
    }

    /**
     * The chatbot answer is released only for a confident match.
     */
    static String answerFor(Decision decision, ResultSet resultSet, FusionConfig config) {
        if (decision.isMatch()) {
            ServiceResult chatbot = resultSet.get(ServiceId.CHATBOT);
            ChatbotPayload answer = chatbot != null ? chatbot.payloadAs(ChatbotPayload.class) : null;
            if (answer != null) {
                return answer.answer();
            }
            String cause = chatbot == null ? "no response before the deadline" : chatbot.status().name();
            return "Person identified, but no answer is available (chatbot: " + cause + ")";
        }
        if (decision.confidence() == null) {
            return "Person not identified. Identity could not be verified (" + decision.reason().code() + ")";
        }
        return String.format(Locale.ROOT, "Person not identified (%s). Confidence: %.2f (required threshold: %.2f)",
                             decision.reason().code(), decision.confidence(), config.threshold());
    }
}
