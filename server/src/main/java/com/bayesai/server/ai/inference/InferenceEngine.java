package com.bayesai.server.ai.inference;

import com.bayesai.server.ai.query.ProbabilityQuery;

public interface InferenceEngine {
    /**
     * Evaluate P(targets | evidence) exactly against the engine's network.
     */
    InferenceResult query(ProbabilityQuery query);

    /**
     * Name under which the engine is selected in configuration.
     */
    String getName();
}
