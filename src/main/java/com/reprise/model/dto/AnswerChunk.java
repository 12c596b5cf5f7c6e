package com.reprise.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One event of a streamed answer.
 *
 * Token events carry a piece of the answer. The last event is marked complete and carries
 * the whole answer (null when the transcript gave no context) plus its provenance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnswerChunk {

    private String token;

    private boolean complete;

    private String answer;

    private Boolean contextAvailable;

    private Boolean cached;

    /**
     * Set on the final event only when the stream broke off.
     */
    private String error;

    public static AnswerChunk token(String token) {
        return AnswerChunk.builder()
                .token(token)
                .complete(false)
                .build();
    }

    public static AnswerChunk complete(String answer, boolean cached) {
        return AnswerChunk.builder()
                .token("")
                .complete(true)
                .answer(answer)
                .contextAvailable(true)
                .cached(cached)
                .build();
    }

    public static AnswerChunk noContext() {
        return AnswerChunk.builder()
                .token("")
                .complete(true)
                .contextAvailable(false)
                .cached(false)
                .build();
    }

    public static AnswerChunk failed(String error) {
        return AnswerChunk.builder()
                .token("")
                .complete(true)
                .error(error)
                .build();
    }
}
