package com.identityplatform.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identityplatform.common.model.ChatbotPayload;
import com.identityplatform.common.model.IdentificationRequest;
import com.identityplatform.common.model.ServiceId;
import com.identityplatform.common.model.ServicePayload;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normative chatbot client. Posts {@code {"message", "provider", "k"}} as JSON to {@code /}
 * and expects an {@code answer} string ({@code response} is accepted as well).
 */
public class ChatbotClient extends AbstractServiceClient {

    private final WebClient webClient;
    private final String defaultProvider;
    private final int defaultTopK;

    public ChatbotClient(WebClient chatbotWebClient, ObjectMapper objectMapper,
                         String defaultProvider, int defaultTopK) {
        super(objectMapper);
        this.webClient       = chatbotWebClient;
        this.defaultProvider = defaultProvider;
        this.defaultTopK     = defaultTopK;
    }

    @Override
    public ServiceId serviceId() {
        return ServiceId.CHATBOT;
    }

    @Override
    protected Mono<ServicePayload> exchange(IdentificationRequest request, String requestId) {
        String provider = request.provider() != null && !request.provider().isBlank()
            ? request.provider() : defaultProvider;
        int topK = request.topK() != null ? request.topK() : defaultTopK;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", request.query());
        body.put("provider", provider);
        body.put("k", topK);

        return webClient.post()
            .uri("/")
            .header(REQUEST_ID_HEADER, requestId)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(String.class)
            .<ServicePayload>map(json -> parse(json, provider));
    }

    ChatbotPayload parse(String body, String provider) {
        JsonNode root = readObject(body);
        JsonNode answer = root.hasNonNull("answer") ? root.get("answer") : root.get("response");
        if (answer == null || answer.isNull()) {
            throw invalid("missing 'answer' (or 'response') field");
        }
        if (!answer.isTextual()) {
            throw invalid("'answer' is not a string: " + answer.getNodeType());
        }
        return new ChatbotPayload(answer.textValue(), provider);
    }
}
