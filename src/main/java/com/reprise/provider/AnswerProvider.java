package com.reprise.provider;

import com.reprise.model.SummaryLength;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Language model that answers from transcript passages.
 * Implementations handle provider-specific authentication, request/response mapping,
 * and API communication.
 */
public interface AnswerProvider {

    /**
     * Get provider name (e.g., "openai").
     */
    String getName();

    /**
     * Answer a question using only the given passages.
     *
     * @param question user question
     * @param passages transcript passages, most relevant first
     * @param model chat model, or null for the configured one
     * @return answer text
     */
    Mono<String> answer(String question, List<String> passages, String model);

    /**
     * Same as {@link #answer}, emitted token by token as the model produces it.
     *
     * @return answer pieces in order; concatenated they form the answer
     */
    Flux<String> streamAnswer(String question, List<String> passages, String model);

    /**
     * Summarize transcript content.
     *
     * @param content transcript text
     * @param length summary length preset
     * @return summary text
     */
    Mono<String> summarize(String content, SummaryLength length);

    /**
     * Check if provider is enabled and configured.
     */
    boolean isEnabled();
}
