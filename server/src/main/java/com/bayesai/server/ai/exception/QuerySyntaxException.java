package com.bayesai.server.ai.exception;

/**
 * A query string that does not match the query grammar. The {@link Reason} tells the caller
 * which rule failed and {@link #getPosition()} where.
 */
public class QuerySyntaxException extends BayesNetworkException {

    public enum Reason {
        EMPTY_QUERY,
        EXPECTED_NAME,
        EXPECTED_VALUE,
        UNVALUED_EVIDENCE,
        UNEXPECTED_CHARACTER
    }

    private final Reason reason;
    private final int position;

    public QuerySyntaxException(String query, Reason reason, int position) {
        super(query, "Invalid query '" + query + "': " + reason + " at position " + position);
        this.reason = reason;
        this.position = position;
    }

    public Reason getReason() {
        return reason;
    }

    public int getPosition() {
        return position;
    }
}
