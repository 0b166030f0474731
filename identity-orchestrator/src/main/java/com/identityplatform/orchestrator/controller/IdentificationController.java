package com.identityplatform.orchestrator.controller;

import com.identityplatform.common.exception.InvalidIdentificationRequestException;
import com.identityplatform.common.model.FusionConfig;
import com.identityplatform.common.model.FusionMethod;
import com.identityplatform.common.model.IdentificationRequest;
import com.identityplatform.orchestrator.dto.IdentificationResponse;
import com.identityplatform.orchestrator.service.IdentificationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Orchestration entry point.
 *
 * <p>Multipart form: {@code image} (file, .jpg/.jpeg/.png), {@code query}, optional
 * {@code provider}, {@code k}, and per-request fusion overrides {@code threshold},
 * {@code margin}, {@code method}.
 */
@RestController
@RequestMapping("/api/v1/identify-and-answer")
public class IdentificationController {

    private static final Logger log = LoggerFactory.getLogger(IdentificationController.class);

    private final IdentificationOrchestrator orchestrator;

    public IdentificationController(IdentificationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<IdentificationResponse>> identifyAndAnswer(ServerWebExchange exchange) {
        return exchange.getMultipartData()
            .flatMap(parts -> {
                FusionConfig config = fusionConfig(parts);
                return readRequest(parts)
                    .flatMap(request -> orchestrator.orchestrate(request, config));
            })
            .map(ResponseEntity::ok)
            .doOnNext(response -> log.info("Identification answered. requestId={} identified={}",
                response.getBody().requestId(), response.getBody().personIdentified()));
    }

    @GetMapping("/health")
    public Mono<String> health() {
        return Mono.just("OK");
    }

    private Mono<IdentificationRequest> readRequest(MultiValueMap<String, Part> parts) {
        if (!(parts.getFirst("image") instanceof FilePart image)) {
            return Mono.error(new InvalidIdentificationRequestException("image", "image file part is required"));
        }
        String query = field(parts, "query");
        String provider = field(parts, "provider");
        Integer topK = parseInteger(parts, "k");

        return DataBufferUtils.join(image.content())
            .map(buffer -> {
                byte[] bytes = new byte[buffer.readableByteCount()];
                buffer.read(bytes);
                DataBufferUtils.release(buffer);
                return bytes;
            })
            .defaultIfEmpty(new byte[0])
            .map(bytes -> new IdentificationRequest(bytes, image.filename(), query, provider, topK));
    }

    private FusionConfig fusionConfig(MultiValueMap<String, Part> parts) {
        Double threshold = parseDouble(parts, "threshold");
        Double margin = parseDouble(parts, "margin");
        String methodValue = field(parts, "method");
        FusionMethod method;
        try {
            method = methodValue != null ? FusionMethod.fromString(methodValue) : null;
        } catch (IllegalArgumentException e) {
            throw new InvalidIdentificationRequestException("method", e.getMessage(), e);
        }
        if (threshold == null && margin == null && method == null) {
            return orchestrator.defaultConfig();
        }
        try {
            return orchestrator.defaultConfig().withOverrides(threshold, margin, method);
        } catch (IllegalArgumentException e) {
            throw new InvalidIdentificationRequestException(threshold != null ? "threshold" : "margin",
                e.getMessage(), e);
        }
    }

    private static String field(MultiValueMap<String, Part> parts, String name) {
        Part part = parts.getFirst(name);
        if (part instanceof FormFieldPart formField) {
            String value = formField.value();
            return value == null || value.isBlank() ? null : value.trim();
        }
        return null;
    }

    private static Integer parseInteger(MultiValueMap<String, Part> parts, String name) {
        String value = field(parts, name);
        if (value == null) return null;
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new InvalidIdentificationRequestException(name, "not an integer: " + value, e);
        }
    }

    private static Double parseDouble(MultiValueMap<String, Part> parts, String name) {
        String value = field(parts, name);
        if (value == null) return null;
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            throw new InvalidIdentificationRequestException(name, "not a number: " + value, e);
        }
    }
}
