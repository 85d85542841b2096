package com.bayesai.server.ai.loader;

import com.bayesai.server.ai.exception.NetworkLoadException;
import com.bayesai.server.ai.exception.StructuralException;
import com.bayesai.server.ai.exception.ValidationException;
import com.bayesai.server.ai.network.BayesianNetwork;
import com.bayesai.server.ai.network.NetworkNode;
import com.bayesai.server.ai.network.RandomVariable;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link BayesianNetwork} from a JSON description:
 *
 * <pre>
 * {
 *   "Alarm": {
 *     "predecessors": ["Burglary", "Earthquake"],
 *     "random_variables": ["t", "f"],
 *     "probabilities": { "(t,t,t)": 0.95, "(t,t,f)": 0.05, ... }
 *   }
 * }
 * </pre>
 *
 * Whitespace inside probability keys is removed before the rows reach the node. Nodes may
 * appear in any order in the file; they are added parents first.
 */
public class NetworkDescriptionLoader {

    private static final Logger logger = LoggerFactory.getLogger(NetworkDescriptionLoader.class);

    public static final String PREDECESSORS_TOKEN = "predecessors";
    public static final String RANDOM_VARIABLES_TOKEN = "random_variables";
    public static final String PROBABILITIES_TOKEN = "probabilities";

    public static class NodeDescription {
        public List<String> predecessors;
        public List<String> random_variables;
        public Map<String, Double> probabilities;
    }

    private final ObjectMapper mapper = new ObjectMapper();

    public Map<String, NodeDescription> readDescription(InputStream in, String source) {
        try {
            return mapper.readValue(in, new TypeReference<LinkedHashMap<String, NodeDescription>>() {
            });
        } catch (IOException e) {
            throw new NetworkLoadException(source, "Failed to read network description from " + source, e);
        }
    }

    public BayesianNetwork load(InputStream in, String source) {
        BayesianNetwork network = build(readDescription(in, source));
        logger.info("Loaded network with {} nodes from {}", network.size(), source);
        return network;
    }

    public BayesianNetwork loadResource(String resource) {
        String path = resource.startsWith("/") ? resource : "/" + resource;
        try (InputStream is = NetworkDescriptionLoader.class.getResourceAsStream(path)) {
            if (is == null) {
                throw new NetworkLoadException(resource, "Network resource " + resource + " not found on classpath",
                        null);
            }
            return load(is, resource);
        } catch (IOException e) {
            throw new NetworkLoadException(resource, "Failed to close network resource " + resource, e);
        }
    }

    public BayesianNetwork loadFile(Path file) {
        try (InputStream is = Files.newInputStream(file)) {
            return load(is, file.toString());
        } catch (IOException e) {
            throw new NetworkLoadException(file.toString(), "Failed to read network file " + file, e);
        }
    }

    /**
     * Validates the description as a whole and adds its nodes to a fresh network, each
     * after all of its predecessors.
     */
    public BayesianNetwork build(Map<String, NodeDescription> description) {
        Map<String, RandomVariable> variables = new HashMap<>();
        for (Map.Entry<String, NodeDescription> e : description.entrySet()) {
            assertEssentialFields(e.getKey(), e.getValue());
            variables.put(e.getKey(), new RandomVariable(e.getKey(), e.getValue().random_variables));
        }
        for (Map.Entry<String, NodeDescription> e : description.entrySet()) {
            for (String predecessor : e.getValue().predecessors) {
                if (!description.containsKey(predecessor)) {
                    throw new StructuralException(predecessor, "No predecessor " + predecessor
                            + " exists in network for node " + e.getKey());
                }
            }
        }

        BayesianNetwork network = new BayesianNetwork();
        Map<String, NodeDescription> pending = new LinkedHashMap<>(description);
        while (!pending.isEmpty()) {
            boolean progress = false;
            Iterator<Map.Entry<String, NodeDescription>> it = pending.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, NodeDescription> e = it.next();
                if (e.getValue().predecessors.stream().allMatch(network::contains)) {
                    network.addNode(toNode(e.getKey(), e.getValue(), variables));
                    it.remove();
                    progress = true;
                }
            }
            if (!progress) {
                String first = pending.keySet().iterator().next();
                throw new StructuralException(first, "Nodes " + pending.keySet()
                        + " cannot be added since acyclic condition does not hold");
            }
        }
        return network;
    }

    /**
     * Builds a single node whose predecessors already exist in {@code network}.
     */
    public NetworkNode toNode(String name, NodeDescription d, BayesianNetwork network) {
        assertEssentialFields(name, d);
        Map<String, RandomVariable> variables = new HashMap<>();
        for (String predecessor : d.predecessors) {
            if (!network.contains(predecessor)) {
                throw new StructuralException(predecessor, "No predecessor " + predecessor
                        + " exists in network for node " + name);
            }
            variables.put(predecessor, network.getNode(predecessor).getVariable());
        }
        variables.put(name, new RandomVariable(name, d.random_variables));
        return toNode(name, d, variables);
    }

    private NetworkNode toNode(String name, NodeDescription d, Map<String, RandomVariable> variables) {
        List<RandomVariable> parents = new ArrayList<>();
        for (String predecessor : d.predecessors) {
            parents.add(variables.get(predecessor));
        }
        return new NetworkNode(variables.get(name), parents, normalizeKeys(d.probabilities));
    }

    /**
     * Removes all whitespace from probability keys, e.g. {@code "(t, f)"} becomes
     * {@code "(t,f)"}.
     */
    public static Map<String, Double> normalizeKeys(Map<String, Double> probabilities) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : probabilities.entrySet()) {
            String key = e.getKey().replaceAll("\\s+", "");
            if (normalized.put(key, e.getValue()) != null) {
                throw new ValidationException(key, "Probability " + key + " is given more than once");
            }
        }
        return normalized;
    }

    private static void assertEssentialFields(String name, NodeDescription d) {
        if (d == null) {
            throw new ValidationException(name, "Check node " + name + ", it has no data");
        }
        if (d.predecessors == null) {
            throw new ValidationException(name, "Check node " + name + ", it lacks the " + PREDECESSORS_TOKEN
                    + " field");
        }
        if (d.random_variables == null) {
            throw new ValidationException(name, "Check node " + name + ", it lacks the " + RANDOM_VARIABLES_TOKEN
                    + " field");
        }
        if (d.probabilities == null) {
            throw new ValidationException(name, "Check node " + name + ", it lacks the " + PROBABILITIES_TOKEN
                    + " field");
        }
        if (d.random_variables.isEmpty()) {
            throw new ValidationException(name, "Node " + name + " should have at least one random variable");
        }
    }
}
