package com.handcoach.orchestrator.narrative;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.handcoach.common.board.BoardTexture;
import com.handcoach.common.exception.NarrativeServiceException;
import com.handcoach.common.strategy.GtoStrategyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * {@link NarrativeClient} backed by the Anthropic Messages API.
 *
 * <p><strong>Reactive contract</strong>: fully non-blocking. Prompt building and JSON handling run
 * inside {@code Mono.fromCallable}; the HTTP exchange is a plain {@link WebClient} chain.
 *
 * <p><strong>Failure contract</strong>: every failure, including a missing API key, surfaces as
 * {@link NarrativeServiceException} on the returned {@code Mono}. This class applies no timeout,
 * retry or fallback; the pipeline's external call guard owns those.
 */
@Service
public class AnthropicNarrativeClient implements NarrativeClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicNarrativeClient.class);

    private final WebClient narrativeWebClient;
    private final ObjectMapper objectMapper;
    private final NarrativeResponseParser responseParser;

    @Value("${coach.narrative.api-key:}")
    private String apiKey;

    @Value("${coach.narrative.model:claude-3-5-haiku-latest}")
    private String model;

    @Value("${coach.narrative.max-tokens:1500}")
    private int maxTokens;

    public AnthropicNarrativeClient(WebClient narrativeWebClient,
                                    ObjectMapper objectMapper,
                                    NarrativeResponseParser responseParser) {
        this.narrativeWebClient = narrativeWebClient;
        this.objectMapper = objectMapper;
        this.responseParser = responseParser;
    }

    @Override
    public Mono<BoardTexture> describeBoard(BoardNarrativeRequest request) {
        return complete(NarrativeResponseParser.BOARD_STAGE, NarrativePrompts.BOARD_SYSTEM_PROMPT,
                        () -> NarrativePrompts.boardPrompt(request))
            .map(text -> responseParser.parseBoard(text, request.board()))
            .doOnSuccess(b -> log.info("[AnthropicNarrative] Board described. handId={} summary={}",
                                       request.handId(), b != null ? b.summary() : null));
    }

    @Override
    public Mono<GtoStrategyTree> generateStrategy(StrategyRequest request) {
        return complete(NarrativeResponseParser.STRATEGY_STAGE, NarrativePrompts.STRATEGY_SYSTEM_PROMPT,
                        () -> NarrativePrompts.strategyPrompt(request, objectMapper))
            .map(text -> responseParser.parseStrategy(text, request.hand().streetsReached()))
            .doOnSuccess(t -> log.info("[AnthropicNarrative] Strategy generated. handId={} streets={}",
                                       request.hand().handId(), t != null ? t.streets().keySet() : null));
    }

    // ── API call ─────────────────────────────────────────────────────────────

    private Mono<String> complete(String stage, String systemPrompt, Callable<String> userPrompt) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new NarrativeServiceException(stage, "No API key configured"));
        }

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(Map.of(
                "model", model,
                "max_tokens", maxTokens,
                "system", systemPrompt,
                "messages", List.of(Map.of("role", "user", "content", userPrompt.call())))))
            .flatMap(bodyJson ->
                narrativeWebClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class))
            .switchIfEmpty(Mono.error(() -> new NarrativeServiceException(stage, "Empty HTTP body")))
            .map(response -> extractText(stage, response))
            .onErrorMap(e -> !(e instanceof NarrativeServiceException),
                        e -> new NarrativeServiceException(stage, "Call failed: " + e.getMessage(), e));
    }

    private String extractText(String stage, String response) {
        JsonNode content;
        try {
            content = objectMapper.readTree(response).path("content");
        } catch (Exception e) {
            throw new NarrativeServiceException(stage, "Failed to read API response", e);
        }
        if (!content.isArray() || content.isEmpty()) {
            throw new NarrativeServiceException(stage, "API response has no content");
        }
        String text = content.get(0).path("text").asText("");
        if (text.isBlank()) throw new NarrativeServiceException(stage, "API response text is empty");
        return text;
    }
}
