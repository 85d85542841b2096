package com.bayesai.server.ai.exception;

public class EnumerationLimitExceededException extends BayesNetworkException {

    private final int hiddenCount;
    private final int limit;

    public EnumerationLimitExceededException(String queryKey, int hiddenCount, int limit) {
        super(queryKey, "Query " + queryKey + " needs " + hiddenCount
                + " hidden variables, configured limit is " + limit);
        this.hiddenCount = hiddenCount;
        this.limit = limit;
    }

    public int getHiddenCount() {
        return hiddenCount;
    }

    public int getLimit() {
        return limit;
    }
}
