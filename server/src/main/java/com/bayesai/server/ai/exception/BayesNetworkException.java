package com.bayesai.server.ai.exception;

/**
 * Base type for every failure raised by the network, the inference engine and the
 * independence analyzer. Carries the identifier (node name, variable name or
 * assignment key) that caused the failure.
 */
public class BayesNetworkException extends RuntimeException {

    private final String identifier;

    public BayesNetworkException(String identifier, String message) {
        super(message);
        this.identifier = identifier;
    }

    public BayesNetworkException(String identifier, String message, Throwable cause) {
        super(message, cause);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
