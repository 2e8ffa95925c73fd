package com.slidemaker.orchestrator.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ModelGateway} backed by the Anthropic Messages API.
 *
 * Plain {@link HttpClient} against the REST endpoint. Each call is a single
 * user turn; an attached image is sent as a base64 content block ahead of
 * the text. The Messages API has no image output, so
 * {@link #generateImage} always fails with {@code UNSUPPORTED}.
 */
@Component
public class ClaudeModelGateway implements ModelGateway {

    private static final Logger log = LoggerFactory.getLogger(ClaudeModelGateway.class);

    // -------------------------------------------------------------------------
    // Wire records
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        String firstText() {
            if (content == null) return null;
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElse(null);
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 8192;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;
    private final URI          endpoint;
    private final Duration     timeout;

    public ClaudeModelGateway(@Value("${anthropic.api-key}") String apiKey,
                              @Value("${anthropic.model:claude-sonnet-4-5}") String model,
                              @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                              @Value("${anthropic.timeout:120s}") Duration timeout,
                              ObjectMapper objectMapper) {
        this.apiKey   = apiKey;
        this.model    = model;
        this.endpoint = URI.create(baseUrl.replaceAll("/+$", "") + "/v1/messages");
        this.timeout  = timeout;
        this.json     = objectMapper;
        this.http     = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // ModelGateway
    // -------------------------------------------------------------------------

    @Override
    public String generate(GenerationRequest request) {
        String requestBody;
        try {
            requestBody = json.writeValueAsString(buildBody(request));
        } catch (JsonProcessingException e) {
            throw new GatewayException(GatewayException.Kind.BAD_REQUEST, "Could not encode request body", e);
        }

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("content-type",      "application/json")
                .header("x-api-key",         apiKey)
                .header("anthropic-version", API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new GatewayException(GatewayException.Kind.TIMEOUT,
                    "No response from %s within %s".formatted(endpoint, timeout), e);
        } catch (IOException e) {
            throw new GatewayException(GatewayException.Kind.TRANSPORT, "Request to " + endpoint + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(GatewayException.Kind.TRANSPORT, "Interrupted while waiting for " + endpoint, e);
        }

        if (response.statusCode() != 200) {
            GatewayException.Kind kind = GatewayException.kindForStatus(response.statusCode());
            log.warn("Model API returned {} ({})", response.statusCode(), kind);
            throw new GatewayException(kind, response.statusCode(),
                    "Model API error %d: %s".formatted(response.statusCode(), abbreviate(response.body())), null);
        }

        String text;
        try {
            text = json.readValue(response.body(), MessagesResponse.class).firstText();
        } catch (JsonProcessingException e) {
            throw new GatewayException(GatewayException.Kind.INVALID_RESPONSE, "Unreadable response body", e);
        }
        if (text == null) {
            throw new GatewayException(GatewayException.Kind.INVALID_RESPONSE, "No text block in response");
        }
        log.debug("Model returned {} chars", text.length());
        return text;
    }

    @Override
    public byte[] generateImage(ImageRequest request) {
        throw new GatewayException(GatewayException.Kind.UNSUPPORTED,
                "Model '%s' cannot generate images (asset %s)".formatted(model, request.assetId()));
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private Map<String, Object> buildBody(GenerationRequest request) {
        Object content = request.prompt();
        if (request.hasImage()) {
            GenerationRequest.ImageAttachment image = request.image();
            content = List.of(
                    Map.of("type", "image",
                           "source", Map.of(
                                   "type",       "base64",
                                   "media_type", image.mediaType(),
                                   "data",       Base64.getEncoder().encodeToString(image.data()))),
                    Map.of("type", "text", "text", request.prompt()));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",      model);
        body.put("max_tokens", MAX_TOKENS);
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            body.put("system", request.systemPrompt());
        }
        body.put("messages", List.of(Map.of("role", "user", "content", content)));
        return body;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 500 ? body : body.substring(0, 500) + "...";
    }
}
