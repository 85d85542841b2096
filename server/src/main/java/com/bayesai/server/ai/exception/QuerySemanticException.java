package com.bayesai.server.ai.exception;

public class QuerySemanticException extends BayesNetworkException {

    public QuerySemanticException(String variableName, String message) {
        super(variableName, message);
    }
}
