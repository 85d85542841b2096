package com.bayesai.server.ai.exception;

public class NetworkLoadException extends BayesNetworkException {

    public NetworkLoadException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
