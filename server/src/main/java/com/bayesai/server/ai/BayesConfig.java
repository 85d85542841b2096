package com.bayesai.server.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Jackson-bound view of {@code bayes_config.json}.
 */
public class BayesConfig {

    private static final Logger logger = LoggerFactory.getLogger(BayesConfig.class);

    public static final String CONFIG_RESOURCE = "/bayes_config.json";

    public static class EngineConfig {
        public String engine = "enumeration";
        public Integer maxHiddenVariables;
    }

    public static class ConfigRoot {
        public String network_file;
        public String removalPolicy = "reject";
        public EngineConfig inference = new EngineConfig();
    }

    public static ConfigRoot read(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        ConfigRoot root = mapper.readValue(in, ConfigRoot.class);
        if (root.inference == null) {
            root.inference = new EngineConfig();
        }
        return root;
    }

    /**
     * Reads the classpath configuration, falling back to defaults if it is absent.
     */
    public static ConfigRoot loadDefault() {
        try (InputStream is = BayesConfig.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                logger.warn("{} not found on classpath, using defaults", CONFIG_RESOURCE);
                return new ConfigRoot();
            }
            return read(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + CONFIG_RESOURCE, e);
        }
    }
}
