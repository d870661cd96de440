package com.assessrec.recommendation.corpus;

/**
 * Raised while building the recommendation context. The service must not start when this is
 * thrown.
 */
public class CorpusConfigurationException extends RuntimeException {

    public CorpusConfigurationException(String message) {
        super(message);
    }

    public CorpusConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
