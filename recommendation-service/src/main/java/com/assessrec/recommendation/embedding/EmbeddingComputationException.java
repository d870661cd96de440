package com.assessrec.recommendation.embedding;

public class EmbeddingComputationException extends RuntimeException {

    public EmbeddingComputationException(String message) {
        super(message);
    }

    public EmbeddingComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
