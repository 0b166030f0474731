package com.identityplatform.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identityplatform.common.model.IdentificationRequest;
import com.identityplatform.common.model.ServiceId;
import com.identityplatform.common.model.ServicePayload;
import com.identityplatform.common.model.VerifierPayload;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Facial verifier client.
 *
 * <p>Sends the image as the multipart part {@code file} with its original file name and a
 * standard image content type to {@code POST /verify}. Expected answer:
 * <pre>
 *   { "confidence": 0.87, "person_id": "p-42", "verified": true }
 * </pre>
 * {@code score} is accepted in place of {@code confidence}; {@code person_id} and
 * {@code verified} are optional. A missing or non-numeric score, or one outside [0, 1],
 * is an invalid response and is never read as a zero score.
 */
public class VerifierClient extends AbstractServiceClient {

    static final String VERIFY_PATH = "/verify";

    private final WebClient webClient;

    public VerifierClient(WebClient verifierWebClient, ObjectMapper objectMapper) {
        super(objectMapper);
        this.webClient = verifierWebClient;
    }

    @Override
    public ServiceId serviceId() {
        return ServiceId.VERIFIER;
    }

    @Override
    protected Mono<ServicePayload> exchange(IdentificationRequest request, String requestId) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", request.image())
            .filename(request.imageFilename())
            .contentType(MediaType.parseMediaType(request.imageContentType()));

        return webClient.post()
            .uri(VERIFY_PATH)
            .header(REQUEST_ID_HEADER, requestId)
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(body.build()))
            .retrieve()
            .bodyToMono(String.class)
            .<ServicePayload>map(this::parse);
    }

    VerifierPayload parse(String body) {
        JsonNode root = readObject(body);

        JsonNode score = root.hasNonNull("confidence") ? root.get("confidence") : root.get("score");
        if (score == null || score.isNull()) {
            throw invalid("missing 'confidence' (or 'score') field. fields=" + fieldNames(root));
        }
        if (!score.isNumber()) {
            throw invalid("'confidence' is not numeric: " + score.getNodeType());
        }
        double confidence = score.asDouble();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw invalid("'confidence' outside [0, 1]: " + confidence);
        }

        String personId = null;
        JsonNode person = root.get("person_id");
        if (person != null && !person.isNull()) {
            if (!person.isTextual() && !person.isNumber()) {
                throw invalid("'person_id' is not a scalar: " + person.getNodeType());
            }
            personId = person.asText();
        }

        Boolean verified = null;
        JsonNode verdict = root.get("verified");
        if (verdict != null && !verdict.isNull()) {
            if (!verdict.isBoolean()) {
                throw invalid("'verified' is not a boolean: " + verdict.getNodeType());
            }
            verified = verdict.booleanValue();
        }

        return new VerifierPayload(confidence, personId, verified);
    }

    private static String fieldNames(JsonNode root) {
        StringBuilder names = new StringBuilder("[");
        root.fieldNames().forEachRemaining(n -> {
            if (names.length() > 1) names.append(", ");
            names.append(n);
        });
        return names.append(']').toString();
    }
}
