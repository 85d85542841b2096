package com.bayesai.server.ai.exception;

/**
 * The evidence of a conditional query has zero prior probability, so the posterior is
 * undefined.
 */
public class ZeroEvidenceProbabilityException extends BayesNetworkException {

    public ZeroEvidenceProbabilityException(String evidenceKey) {
        super(evidenceKey, "Evidence " + evidenceKey + " has zero probability; posterior is undefined");
    }
}
