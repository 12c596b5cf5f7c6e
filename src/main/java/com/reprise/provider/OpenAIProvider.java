package com.reprise.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.config.RepriseProperties;
import com.reprise.exception.UpstreamUnavailableException;
import com.reprise.model.ChatCompletionChunk;
import com.reprise.model.ChatCompletionRequest;
import com.reprise.model.ChatCompletionResponse;
import com.reprise.model.Message;
import com.reprise.model.SummaryLength;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.StringSubstitutor;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * OpenAI chat completion provider for transcript-grounded answers and summaries.
 */
@Slf4j
@Component
public class OpenAIProvider extends AbstractProvider implements AnswerProvider {

    static final String SYSTEM_PROMPT =
            "You are a precise assistant answering questions strictly based on the content of the "
                    + "video transcript provided. If the answer is not clearly stated in the transcript, "
                    + "say you cannot find the answer. Do not guess or add unrelated information. "
                    + "Only use the transcript to answer. Stay on-topic, concise, and evidence-based.";

    private static final String ANSWER_TEMPLATE = "Question: ${question}\n\nTranscript:\n${transcript}";
    private static final String SUMMARY_TEMPLATE = "Transcript:\n${transcript}";
    private static final String PASSAGE_SEPARATOR = "\n\n";
    private static final double SUMMARY_TEMPERATURE = 0.3;
    private static final String DONE_MARKER = "[DONE]";
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final ObjectMapper objectMapper;

    public OpenAIProvider(WebClient webClient, RepriseProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, "openai");
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "openai";
    }

    @Override
    public Mono<String> answer(String question, List<String> passages, String model) {
        return complete(answerRequest(question, passages, model));
    }

    @Override
    public Flux<String> streamAnswer(String question, List<String> passages, String model) {
        ChatCompletionRequest request = answerRequest(question, passages, model).toBuilder()
                .stream(true)
                .build();
        log.info("Streaming request to OpenAI: model={}, maxTokens={}", request.getModel(), request.getMaxTokens());

        Flux<String> tokens = Flux.defer(() -> webClient.post()
                        .uri(config.getBaseUrl() + "/chat/completions")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .bodyValue(request)
                        .retrieve()
                        .bodyToFlux(SSE_TYPE))
                .map(event -> event.data() != null ? event.data() : "")
                .takeWhile(data -> !DONE_MARKER.equals(data.strip()))
                .filter(data -> !data.isBlank())
                .concatMap(this::parseChunk)
                .mapNotNull(ChatCompletionChunk::firstDeltaContent)
                .filter(token -> !token.isEmpty());

        return executeStream(tokens);
    }

    @Override
    public Mono<String> summarize(String content, SummaryLength length) {
        String prompt = render(SUMMARY_TEMPLATE, Map.of("transcript", content));

        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(chatModel())
                .messages(List.of(Message.system(length.getInstruction()), Message.user(prompt)))
                .temperature(SUMMARY_TEMPERATURE)
                .maxTokens(length.getMaxTokens())
                .build();

        return complete(request);
    }

    private Mono<String> complete(ChatCompletionRequest request) {
        log.info("Forwarding request to OpenAI: model={}, maxTokens={}", request.getModel(), request.getMaxTokens());

        Mono<ChatCompletionResponse> responseMono = Mono.defer(() -> webClient.post()
                .uri(config.getBaseUrl() + "/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class));

        return executeWithRetry(responseMono)
                .flatMap(response -> {
                    String content = response.firstContent();
                    if (content == null) {
                        return Mono.error(new UpstreamUnavailableException("OpenAI returned no completion"));
                    }
                    return Mono.just(content.strip());
                });
    }

    ChatCompletionRequest answerRequest(String question, List<String> passages, String model) {
        String prompt = render(ANSWER_TEMPLATE, Map.of(
                "question", question,
                "transcript", String.join(PASSAGE_SEPARATOR, passages)));

        return ChatCompletionRequest.builder()
                .model(StringUtils.isNotBlank(model) ? model : chatModel())
                .messages(List.of(Message.system(SYSTEM_PROMPT), Message.user(prompt)))
                .temperature(config != null ? config.getTemperature() : null)
                .maxTokens(config != null ? config.getMaxTokens() : null)
                .build();
    }

    private Mono<ChatCompletionChunk> parseChunk(String data) {
        try {
            return Mono.just(objectMapper.readValue(data, ChatCompletionChunk.class));
        } catch (JsonProcessingException e) {
            return Mono.error(new UpstreamUnavailableException("Unreadable OpenAI stream chunk", e));
        }
    }

    /**
     * Fill a prompt template. Placeholders inside the values are left as typed.
     */
    static String render(String template, Map<String, String> values) {
        StringSubstitutor substitutor = new StringSubstitutor(values);
        substitutor.setDisableSubstitutionInValues(true);
        return substitutor.replace(template);
    }

    private String chatModel() {
        return config != null ? config.getChatModel() : null;
    }
}
