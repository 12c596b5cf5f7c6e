package com.reprise.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Replays cached answers in the same token-by-token shape as a live model stream.
 * Deterministic: the same answer always produces the same pieces.
 */
@Slf4j
@Service
public class StreamingService {

    // Characters per piece
    private static final int CHUNK_SIZE = 8;

    // Cached answers stream faster than a live model
    private static final Duration CHUNK_DELAY = Duration.ofMillis(10);

    /**
     * @param answer cached answer
     * @return pieces whose concatenation is {@code answer}
     */
    public Flux<String> replay(String answer) {
        List<String> pieces = split(answer);
        return Flux.fromIterable(pieces)
                .delayElements(CHUNK_DELAY)
                .doOnComplete(() -> log.debug("Replayed cached answer in {} pieces", pieces.size()));
    }

    /**
     * Split into pieces of about {@link #CHUNK_SIZE} characters,
     * extending a piece up to 3 characters to end on whitespace.
     */
    static List<String> split(String content) {
        List<String> chunks = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return chunks;
        }

        int pos = 0;
        while (pos < content.length()) {
            int endPos = Math.min(pos + CHUNK_SIZE, content.length());

            if (endPos < content.length()) {
                for (int i = endPos; i < Math.min(endPos + 3, content.length()); i++) {
                    if (Character.isWhitespace(content.charAt(i))) {
                        endPos = i + 1;
                        break;
                    }
                }
            }

            chunks.add(content.substring(pos, endPos));
            pos = endPos;
        }
        return chunks;
    }
}
