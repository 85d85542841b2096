package com.bayesai.server.util;

import com.bayesai.server.ai.BayesConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NetworkPathResolverTest {

    @AfterEach
    public void clearProperty() {
        System.clearProperty(NetworkPathResolver.SYSTEM_PROPERTY);
    }

    @Test
    public void testResolutionOrder() {
        BayesConfig.ConfigRoot config = new BayesConfig.ConfigRoot();

        // 1. Nothing configured
        assertEquals(NetworkPathResolver.DEFAULT_NETWORK, NetworkPathResolver.resolveNetworkFile(config));
        assertEquals(NetworkPathResolver.DEFAULT_NETWORK, NetworkPathResolver.resolveNetworkFile(null));

        // 2. Config file entry
        config.network_file = "networks/student.json";
        assertEquals("networks/student.json", NetworkPathResolver.resolveNetworkFile(config));

        // 3. System property wins
        System.setProperty(NetworkPathResolver.SYSTEM_PROPERTY, "/tmp/custom.json");
        assertEquals("/tmp/custom.json", NetworkPathResolver.resolveNetworkFile(config));
    }

    @Test
    public void testEmptyValuesAreIgnored() {
        BayesConfig.ConfigRoot config = new BayesConfig.ConfigRoot();
        config.network_file = "";
        System.setProperty(NetworkPathResolver.SYSTEM_PROPERTY, "");
        assertEquals(NetworkPathResolver.DEFAULT_NETWORK, NetworkPathResolver.resolveNetworkFile(config));
    }
}
