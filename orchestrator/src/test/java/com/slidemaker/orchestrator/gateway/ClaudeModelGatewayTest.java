package com.slidemaker.orchestrator.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises ClaudeModelGateway against a local stub of the Messages endpoint.
 */
class ClaudeModelGatewayTest {

    private final ObjectMapper json = new ObjectMapper();

    HttpServer server;
    AtomicReference<String> lastBody = new AtomicReference<>();
    AtomicReference<String> lastApiKey = new AtomicReference<>();
    volatile int status = 200;
    volatile String responseBody = "";

    ClaudeModelGateway gateway;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/messages", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastApiKey.set(exchange.getRequestHeaders().getFirst("x-api-key"));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();

        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        gateway = new ClaudeModelGateway("test-key", "claude-test", baseUrl, Duration.ofSeconds(5), json);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(int code, String body) {
        status = code;
        responseBody = body;
    }

    // ------------------------------------------------------------------
    // Success
    // ------------------------------------------------------------------

    @Test
    void generate_ok_returnsFirstTextBlock() throws Exception {
        respond(200, """
                {"id": "msg_1", "content": [{"type": "text", "text": "{\\"pages\\": []}"}], "stop_reason": "end_turn"}
                """);

        String text = gateway.generate(GenerationRequest.text("be brief", "compose"));

        assertThat(text).isEqualTo("{\"pages\": []}");
        JsonNode sent = json.readTree(lastBody.get());
        assertThat(sent.path("model").asText()).isEqualTo("claude-test");
        assertThat(sent.path("system").asText()).isEqualTo("be brief");
        assertThat(sent.path("messages").get(0).path("content").asText()).isEqualTo("compose");
        assertThat(lastApiKey.get()).isEqualTo("test-key");
    }

    @Test
    void generate_withImage_sendsBase64BlockBeforeText() throws Exception {
        respond(200, "{\"content\": [{\"type\": \"text\", \"text\": \"ok\"}]}");

        gateway.generate(GenerationRequest.withImage(null, "describe", new byte[]{1, 2, 3}, "image/png"));

        JsonNode content = json.readTree(lastBody.get()).path("messages").get(0).path("content");
        assertThat(content.get(0).path("type").asText()).isEqualTo("image");
        assertThat(content.get(0).path("source").path("media_type").asText()).isEqualTo("image/png");
        assertThat(content.get(0).path("source").path("data").asText()).isEqualTo("AQID");
        assertThat(content.get(1).path("text").asText()).isEqualTo("describe");
        assertThat(json.readTree(lastBody.get()).has("system")).isFalse();
    }

    // ------------------------------------------------------------------
    // Error mapping
    // ------------------------------------------------------------------

    @Test
    void generate_401_isNonRetryableAuthentication() {
        respond(401, "{\"error\": {\"type\": \"authentication_error\"}}");

        assertThatThrownBy(() -> gateway.generate(GenerationRequest.text(null, "x")))
                .isInstanceOfSatisfying(GatewayException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(GatewayException.Kind.AUTHENTICATION);
                    assertThat(e.statusCode()).isEqualTo(401);
                    assertThat(e.isRetryable()).isFalse();
                });
    }

    @Test
    void generate_429_isRetryableRateLimit() {
        respond(429, "{\"error\": {\"type\": \"rate_limit_error\"}}");

        assertThatThrownBy(() -> gateway.generate(GenerationRequest.text(null, "x")))
                .isInstanceOfSatisfying(GatewayException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(GatewayException.Kind.RATE_LIMITED);
                    assertThat(e.isRetryable()).isTrue();
                });
    }

    @Test
    void generate_529_isServerError() {
        respond(529, "{\"error\": {\"type\": \"overloaded_error\"}}");

        assertThatThrownBy(() -> gateway.generate(GenerationRequest.text(null, "x")))
                .isInstanceOfSatisfying(GatewayException.class,
                        e -> assertThat(e.getKind()).isEqualTo(GatewayException.Kind.SERVER_ERROR));
    }

    @Test
    void generate_noTextBlock_isInvalidResponse() {
        respond(200, "{\"content\": [{\"type\": \"tool_use\"}]}");

        assertThatThrownBy(() -> gateway.generate(GenerationRequest.text(null, "x")))
                .isInstanceOfSatisfying(GatewayException.class,
                        e -> assertThat(e.getKind()).isEqualTo(GatewayException.Kind.INVALID_RESPONSE));
    }

    @Test
    void generate_unreachableHost_isTransport() {
        server.stop(0);

        assertThatThrownBy(() -> gateway.generate(GenerationRequest.text(null, "x")))
                .isInstanceOfSatisfying(GatewayException.class,
                        e -> assertThat(e.getKind()).isIn(GatewayException.Kind.TRANSPORT, GatewayException.Kind.TIMEOUT));
    }

    @Test
    void generateImage_isUnsupported() {
        assertThatThrownBy(() -> gateway.generateImage(new ImageRequest("hero", "a cat", null)))
                .isInstanceOfSatisfying(GatewayException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(GatewayException.Kind.UNSUPPORTED);
                    assertThat(e.isRetryable()).isFalse();
                });
    }

    @Test
    void kindForStatus_coversProviderStatuses() {
        assertThat(GatewayException.kindForStatus(403)).isEqualTo(GatewayException.Kind.AUTHENTICATION);
        assertThat(GatewayException.kindForStatus(408)).isEqualTo(GatewayException.Kind.TIMEOUT);
        assertThat(GatewayException.kindForStatus(504)).isEqualTo(GatewayException.Kind.TIMEOUT);
        assertThat(GatewayException.kindForStatus(500)).isEqualTo(GatewayException.Kind.SERVER_ERROR);
        assertThat(GatewayException.kindForStatus(400)).isEqualTo(GatewayException.Kind.BAD_REQUEST);
    }
}
