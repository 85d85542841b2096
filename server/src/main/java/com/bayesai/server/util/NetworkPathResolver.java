package com.bayesai.server.util;

import com.bayesai.server.ai.BayesConfig;

public class NetworkPathResolver {

    public static final String SYSTEM_PROPERTY = "bayes.network.file";
    public static final String DEFAULT_NETWORK = "networks/alarm.json";

    public static String resolveNetworkFile(BayesConfig.ConfigRoot config) {
        // 1. Check System Property
        String sysProp = System.getProperty(SYSTEM_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Check Config File
        if (config != null && config.network_file != null && !config.network_file.isEmpty()) {
            return config.network_file;
        }

        // 3. Default
        return DEFAULT_NETWORK;
    }
}
