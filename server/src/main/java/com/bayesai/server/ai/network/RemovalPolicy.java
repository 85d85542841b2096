package com.bayesai.server.ai.network;

public enum RemovalPolicy {
    /** Refuse to remove a node that is still a parent of another node. */
    REJECT,
    /** Remove the node together with all of its descendants. */
    CASCADE;

    public static RemovalPolicy fromString(String s) {
        if (s == null) {
            return REJECT;
        }
        return "cascade".equalsIgnoreCase(s.trim()) ? CASCADE : REJECT;
    }
}
