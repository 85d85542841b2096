package com.bayesai.server.ai.inference;

import com.bayesai.server.ai.BayesConfig;
import com.bayesai.server.ai.network.BayesianNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InferenceEngineFactory {

    private static final Logger logger = LoggerFactory.getLogger(InferenceEngineFactory.class);

    public static InferenceEngine create(BayesConfig.EngineConfig config, BayesianNetwork network) {
        String engine = (config != null) ? config.engine : null;
        Integer maxHidden = (config != null) ? config.maxHiddenVariables : null;

        if (engine == null || engine.trim().isEmpty()) {
            logger.warn("Engine not specified, defaulting to 'enumeration'");
            engine = "enumeration";
        }

        switch (engine.trim().toLowerCase()) {
            case "enumeration":
                return new EnumerationInferenceEngine(network, maxHidden);
            case "ancestral":
                return new AncestralInferenceEngine(network, maxHidden);
            default:
                logger.warn("Unknown engine '{}', defaulting to 'enumeration'", engine);
                return new EnumerationInferenceEngine(network, maxHidden);
        }
    }

    public static InferenceEngine create(String engine, BayesianNetwork network) {
        BayesConfig.EngineConfig cfg = new BayesConfig.EngineConfig();
        cfg.engine = engine;
        return create(cfg, network);
    }
}
