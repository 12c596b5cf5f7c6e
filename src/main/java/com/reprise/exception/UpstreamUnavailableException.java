package com.reprise.exception;

/**
 * An external collaborator (dense similarity search, embeddings, LLM) failed or timed out.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
