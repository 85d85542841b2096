package com.bayesai.server.ai.exception;

/**
 * Raised when a mutation would break the graph: a cycle, a missing parent, a duplicate
 * node or a node that still has dependents.
 */
public class StructuralException extends BayesNetworkException {

    public StructuralException(String nodeName, String message) {
        super(nodeName, message);
    }
}
