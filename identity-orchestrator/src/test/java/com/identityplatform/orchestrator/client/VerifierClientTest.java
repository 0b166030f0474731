package com.identityplatform.orchestrator.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.identityplatform.common.model.IdentificationRequest;
import com.identityplatform.common.model.ServiceId;
import com.identityplatform.common.model.ServiceResult;
import com.identityplatform.common.model.ServiceStatus;
import com.identityplatform.common.model.VerifierPayload;
import com.identityplatform.common.trace.RequestTraceContext;
import com.identityplatform.orchestrator.support.StubExchange;
import io.netty.handler.timeout.ReadTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.client.ClientRequest;
import reactor.test.StepVerifier;
import reactor.util.context.Context;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class VerifierClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static IdentificationRequest request(String filename) {
        return new IdentificationRequest("jpeg-bytes".getBytes(StandardCharsets.UTF_8), filename,
            "Which article regulates attendance?", null, null);
    }

    private ServiceResult call(StubExchange stub, Duration timeout) {
        VerifierClient client = new VerifierClient(stub.webClient("http://verifier.test"), objectMapper);
        return client.call(request("face.jpg"), timeout).block(Duration.ofSeconds(5));
    }

    // ── successful answers ────────────────────────────────────────────────

    @Nested
    @DisplayName("well-formed responses")
    class WellFormed {

        @Test
        @DisplayName("confidence, person_id and verified are read into the payload")
        void fullResponse() {
            ServiceResult result = call(StubExchange.ok(
                "{\"confidence\": 0.87, \"person_id\": \"p-42\", \"verified\": true}"), TIMEOUT);

            assertEquals(ServiceId.VERIFIER, result.serviceId());
            assertEquals(ServiceStatus.SUCCESS, result.status());
            VerifierPayload payload = result.payloadAs(VerifierPayload.class);
            assertEquals(0.87, payload.confidence(), 1e-9);
            assertEquals("p-42", payload.personId());
            assertEquals(Boolean.TRUE, payload.verified());
            assertNull(result.errorDetail());
        }

        @Test
        @DisplayName("'score' is accepted in place of 'confidence'; optional fields may be absent")
        void scoreAlias() {
            ServiceResult result = call(StubExchange.ok("{\"score\": 0.5}"), TIMEOUT);

            assertEquals(ServiceStatus.SUCCESS, result.status());
            VerifierPayload payload = result.payloadAs(VerifierPayload.class);
            assertEquals(0.5, payload.confidence(), 1e-9);
            assertNull(payload.personId());
            assertNull(payload.verified());
        }

        @Test
        @DisplayName("numeric person_id is kept as text")
        void numericPersonId() {
            ServiceResult result = call(StubExchange.ok("{\"confidence\": 1.0, \"person_id\": 1234}"), TIMEOUT);

            assertEquals("1234", result.payloadAs(VerifierPayload.class).personId());
        }

        @Test
        @DisplayName("boundary confidences 0 and 1 are valid")
        void boundaryConfidence() {
            assertEquals(ServiceStatus.SUCCESS, call(StubExchange.ok("{\"confidence\": 0}"), TIMEOUT).status());
            assertEquals(ServiceStatus.SUCCESS, call(StubExchange.ok("{\"confidence\": 1}"), TIMEOUT).status());
        }
    }

    // ── shape violations ──────────────────────────────────────────────────

    @Nested
    @DisplayName("malformed responses → INVALID_RESPONSE")
    class Malformed {

        @Test
        @DisplayName("missing confidence is not read as a zero score")
        void missingConfidence() {
            ServiceResult result = call(StubExchange.ok("{\"person_id\": \"p-1\", \"verified\": true}"), TIMEOUT);

            assertEquals(ServiceStatus.INVALID_RESPONSE, result.status());
            assertNull(result.payload());
            assertTrue(result.errorDetail().contains("confidence"));
        }

        @Test
        @DisplayName("non-numeric confidence")
        void textConfidence() {
            assertEquals(ServiceStatus.INVALID_RESPONSE,
                call(StubExchange.ok("{\"confidence\": \"high\"}"), TIMEOUT).status());
        }

        @Test
        @DisplayName("confidence outside [0, 1]")
        void outOfRange() {
            assertEquals(ServiceStatus.INVALID_RESPONSE,
                call(StubExchange.ok("{\"confidence\": 1.5}"), TIMEOUT).status());
            assertEquals(ServiceStatus.INVALID_RESPONSE,
                call(StubExchange.ok("{\"confidence\": -0.1}"), TIMEOUT).status());
        }

        @Test
        @DisplayName("verified flag that is not a boolean")
        void nonBooleanVerdict() {
            assertEquals(ServiceStatus.INVALID_RESPONSE,
                call(StubExchange.ok("{\"confidence\": 0.9, \"verified\": \"yes\"}"), TIMEOUT).status());
        }

        @Test
        @DisplayName("body that is not JSON")
        void notJson() {
            ServiceResult result = call(StubExchange.ok("<html>gateway</html>"), TIMEOUT);

            assertEquals(ServiceStatus.INVALID_RESPONSE, result.status());
            assertTrue(result.errorDetail().contains("not valid JSON"));
        }

        @Test
        @DisplayName("JSON array instead of an object")
        void arrayBody() {
            assertEquals(ServiceStatus.INVALID_RESPONSE, call(StubExchange.ok("[0.9]"), TIMEOUT).status());
        }

        @Test
        @DisplayName("empty body")
        void emptyBody() {
            assertEquals(ServiceStatus.INVALID_RESPONSE, call(StubExchange.ok(""), TIMEOUT).status());
        }
    }

    // ── transport and timeout ─────────────────────────────────────────────

    @Nested
    @DisplayName("transport failures and timeouts")
    class Failures {

        @Test
        @DisplayName("HTTP 502 → TRANSPORT_ERROR with status and body in the detail")
        void badGateway() {
            ServiceResult result = call(StubExchange.json(HttpStatus.BAD_GATEWAY, "{\"error\":\"upstream\"}"), TIMEOUT);

            assertEquals(ServiceStatus.TRANSPORT_ERROR, result.status());
            assertTrue(result.errorDetail().startsWith("HTTP 502"), result.errorDetail());
            assertTrue(result.errorDetail().contains("upstream"));
        }

        @Test
        @DisplayName("connection refused → TRANSPORT_ERROR")
        void connectionRefused() {
            ServiceResult result = call(StubExchange.connectionRefused(), TIMEOUT);

            assertEquals(ServiceStatus.TRANSPORT_ERROR, result.status());
            assertTrue(result.errorDetail().contains("ConnectException"), result.errorDetail());
        }

        @Test
        @DisplayName("no answer within the timeout → TIMEOUT, bounded by the timeout")
        void slowService() {
            Duration timeout = Duration.ofMillis(100);
            ServiceResult result = call(StubExchange.never(), timeout);

            assertEquals(ServiceStatus.TIMEOUT, result.status());
            assertNull(result.payload());
            assertTrue(result.latency().compareTo(timeout) >= 0);
            assertTrue(result.latency().compareTo(Duration.ofSeconds(2)) < 0);
        }

        @Test
        @DisplayName("Netty read timeout → TIMEOUT, not TRANSPORT_ERROR")
        void nettyReadTimeout() {
            ServiceResult result = call(StubExchange.failing(ReadTimeoutException.INSTANCE), TIMEOUT);

            assertEquals(ServiceStatus.TIMEOUT, result.status());
        }

        @Test
        @DisplayName("call never errors: failures are emitted as results")
        void neverErrors() {
            VerifierClient client = new VerifierClient(
                StubExchange.connectionRefused().webClient("http://verifier.test"), objectMapper);

            StepVerifier.create(client.call(request("face.png"), TIMEOUT))
                .assertNext(result -> assertEquals(ServiceStatus.TRANSPORT_ERROR, result.status()))
                .verifyComplete();
        }
    }

    // ── request encoding ──────────────────────────────────────────────────

    @Nested
    @DisplayName("request encoding")
    class Encoding {

        @Test
        @DisplayName("image sent as multipart part 'file' with file name and image/jpeg content type")
        void multipartJpeg() {
            StubExchange stub = StubExchange.ok("{\"confidence\": 0.9}");
            VerifierClient client = new VerifierClient(stub.webClient("http://verifier.test"), objectMapper);

            client.call(request("face.jpg"), TIMEOUT)
                .contextWrite(Context.of(RequestTraceContext.REQUEST_ID_KEY, "req-123"))
                .block(Duration.ofSeconds(5));

            ClientRequest sent = stub.lastRequest();
            assertEquals("http://verifier.test/verify", sent.url().toString());
            assertEquals("req-123", sent.headers().getFirst(AbstractServiceClient.REQUEST_ID_HEADER));

            MockClientHttpRequest rendered = StubExchange.render(sent);
            MediaType contentType = rendered.getHeaders().getContentType();
            assertTrue(MediaType.MULTIPART_FORM_DATA.isCompatibleWith(contentType));
            assertNotNull(contentType.getParameter("boundary"));

            String body = rendered.getBodyAsString().block(Duration.ofSeconds(5));
            assertTrue(body.contains("name=\"file\"; filename=\"face.jpg\""), body);
            assertTrue(body.contains("Content-Type: image/jpeg"), body);
            assertFalse(body.contains("image/jpg\r"), body);
            assertTrue(body.contains("jpeg-bytes"), body);
        }

        @Test
        @DisplayName(".png images use image/png")
        void multipartPng() {
            StubExchange stub = StubExchange.ok("{\"confidence\": 0.9}");
            VerifierClient client = new VerifierClient(stub.webClient("http://verifier.test"), objectMapper);

            client.call(request("face.PNG"), TIMEOUT).block(Duration.ofSeconds(5));

            String body = StubExchange.render(stub.lastRequest()).getBodyAsString().block(Duration.ofSeconds(5));
            assertTrue(body.contains("Content-Type: image/png"), body);
        }

        @Test
        @DisplayName("request id defaults to 'unknown' outside an orchestration context")
        void unknownRequestId() {
            StubExchange stub = StubExchange.ok("{\"confidence\": 0.9}");
            new VerifierClient(stub.webClient("http://verifier.test"), objectMapper)
                .call(request("face.jpg"), TIMEOUT)
                .block(Duration.ofSeconds(5));

            assertEquals("unknown", stub.lastRequest().headers().getFirst(AbstractServiceClient.REQUEST_ID_HEADER));
        }
    }

    @Test
    @DisplayName("exchange errors of unknown type are classified as TRANSPORT_ERROR")
    void unexpectedError() {
        ServiceResult result = call(StubExchange.erroring(new IllegalStateException("codec exploded")), TIMEOUT);

        assertEquals(ServiceStatus.TRANSPORT_ERROR, result.status());
        assertTrue(result.errorDetail().contains("IllegalStateException"));
    }
}
