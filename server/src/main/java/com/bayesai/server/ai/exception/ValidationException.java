package com.bayesai.server.ai.exception;

/**
 * Raised when a node or its probability table is malformed.
 */
public class ValidationException extends BayesNetworkException {

    public ValidationException(String identifier, String message) {
        super(identifier, message);
    }
}
