package com.whereq.forge.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.exception.GenerationException;
import com.whereq.forge.exception.PermanentGenerationException;
import com.whereq.forge.exception.TransientGenerationException;
import com.whereq.forge.model.GenerationResult;
import com.whereq.forge.model.JobType;
import com.whereq.forge.model.payload.ArticlePayload;
import com.whereq.forge.model.payload.GenerationPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Calls the HTTP generation backend.
 *
 * Articles go to {@code /api/generation/{mode}}, images to {@code /api/images/generate}
 * and videos to {@code /api/videos/generate}. Request bodies use snake_case field names.
 * Connection failures, timeouts, 408, 429 and 5xx responses are transient; any other
 * rejection, including a {@code success: false} body, is permanent.
 */
@Slf4j
@Component
public class HttpGenerationClient implements GenerationClient {

    private static final int MAX_ERROR_BODY_LENGTH = 500;

    private final WebClient webClient;
    private final ObjectMapper requestMapper;
    private final Duration timeout;

    public HttpGenerationClient(WebClient generationWebClient, ObjectMapper objectMapper, ForgeProperties properties) {
        this.webClient = generationWebClient;
        this.requestMapper = objectMapper.copy()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.timeout = properties.getGeneration().getTimeout();
    }

    @Override
    public Mono<GenerationResult> generate(JobType type, GenerationPayload payload) {
        if (payload.getType() != type) {
            return Mono.error(new PermanentGenerationException(
                "Payload of type " + payload.getType().getValue() + " sent as " + type.getValue() + " job"));
        }

        String path = pathFor(type, payload);
        ObjectNode body = requestMapper.valueToTree(payload);
        body.remove("mode");

        log.debug("Calling generation backend {} for {} job", path, type.getValue());

        return webClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::isError, this::classifyErrorResponse)
            .bodyToMono(JsonNode.class)
            .switchIfEmpty(Mono.error(() -> new TransientGenerationException(
                "Empty response from generation backend " + path)))
            .map(response -> toResult(type, payload, response))
            .timeout(timeout)
            .onErrorMap(TimeoutException.class, e -> new TransientGenerationException(
                "Generation backend " + path + " did not respond within " + timeout, e))
            .onErrorMap(WebClientRequestException.class, e -> new TransientGenerationException(
                "Generation backend unreachable: " + e.getMessage(), e))
            .doOnError(GenerationException.class, e -> log.warn("Generation call {} failed ({}): {}",
                path, e.isRetryable() ? "transient" : "permanent", e.getMessage()));
    }

    private static String pathFor(JobType type, GenerationPayload payload) {
        return switch (type) {
            case ARTICLE -> "/api/generation/" + ((ArticlePayload) payload).getMode().getValue();
            case IMAGE -> "/api/images/generate";
            case VIDEO -> "/api/videos/generate";
        };
    }

    private Mono<? extends Throwable> classifyErrorResponse(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> {
                String message = "Generation backend returned " + status.value() + describeBody(body);
                if (isTransient(status)) {
                    return new TransientGenerationException(message);
                }
                return new PermanentGenerationException(message);
            });
    }

    static boolean isTransient(HttpStatusCode status) {
        return status.is5xxServerError()
            || status.value() == HttpStatus.REQUEST_TIMEOUT.value()
            || status.value() == HttpStatus.TOO_MANY_REQUESTS.value();
    }

    private GenerationResult toResult(JobType type, GenerationPayload payload, JsonNode response) {
        if (!response.path("success").asBoolean(false)) {
            String reason = textOrNull(response, type == JobType.ARTICLE ? "message" : "error");
            throw new PermanentGenerationException("Generation rejected: "
                + (reason != null ? reason : "backend reported failure"));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        JsonNode reported = response.get("metadata");
        if (reported != null && reported.isObject()) {
            metadata.putAll(requestMapper.convertValue(reported, Map.class));
        }
        if (response.hasNonNull("generation_time")) {
            metadata.put("generationTime", response.get("generation_time").asDouble());
        }

        GenerationResult.GenerationResultBuilder result = GenerationResult.builder().metadata(metadata);
        switch (type) {
            case ARTICLE -> {
                String content = textOrNull(response, "content");
                if (content == null) {
                    throw new PermanentGenerationException("Generation backend returned no article content");
                }
                result.content(content).title(((ArticlePayload) payload).getDisplayTitle());
            }
            case IMAGE -> result.url(requireUrl(response, "image_url"));
            case VIDEO -> result.url(requireUrl(response, "video_url"));
        }
        return result.build();
    }

    private static String requireUrl(JsonNode response, String field) {
        String url = textOrNull(response, field);
        if (url == null) {
            throw new PermanentGenerationException("Generation backend returned no " + field);
        }
        return url;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.asText().isBlank() ? null : value.asText();
    }

    private static String describeBody(String body) {
        if (body.isBlank()) {
            return "";
        }
        return ": " + (body.length() > MAX_ERROR_BODY_LENGTH ? body.substring(0, MAX_ERROR_BODY_LENGTH) + "..." : body);
    }
}
