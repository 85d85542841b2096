package com.bayesai.server.ai.exception;

/**
 * A node was addressed by a name the network does not hold.
 */
public class UnknownNodeException extends StructuralException {

    public UnknownNodeException(String nodeName) {
        super(nodeName, nodeName + " does not exist in the network");
    }
}
