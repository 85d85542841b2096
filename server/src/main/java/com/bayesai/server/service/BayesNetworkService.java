package com.bayesai.server.service;

import com.bayesai.server.ai.BayesConfig;
import com.bayesai.server.ai.independence.IndependenceAnalyzer;
import com.bayesai.server.ai.independence.IndependenceQuery;
import com.bayesai.server.ai.inference.InferenceEngine;
import com.bayesai.server.ai.inference.InferenceEngineFactory;
import com.bayesai.server.ai.inference.InferenceResult;
import com.bayesai.server.ai.loader.NetworkDescriptionLoader;
import com.bayesai.server.ai.network.BayesianNetwork;
import com.bayesai.server.ai.network.NetworkNode;
import com.bayesai.server.ai.network.RemovalPolicy;
import com.bayesai.server.ai.query.ProbabilityQuery;
import com.bayesai.server.ai.query.QueryParser;
import com.bayesai.server.util.NetworkPathResolver;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Owns the live network. Queries run under the read lock and may overlap; mutations take
 * the write lock, so no query ever observes a half-applied change.
 */
@Service
public class BayesNetworkService {

    private static final Logger logger = LoggerFactory.getLogger(BayesNetworkService.class);

    public static class NodeSummary {
        public String name;
        public List<String> domain;
        public List<String> parents;
        public List<String> children;
    }

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final NetworkDescriptionLoader loader = new NetworkDescriptionLoader();
    private final BayesConfig.ConfigRoot config;

    private BayesianNetwork network;
    private InferenceEngine engine;
    private IndependenceAnalyzer analyzer;
    private volatile boolean isReady = false;

    public BayesNetworkService() {
        this(BayesConfig.loadDefault(), null);
    }

    /**
     * @param network network to serve; when null the configured network is loaded by
     *                {@link #init()}
     */
    public BayesNetworkService(BayesConfig.ConfigRoot config, BayesianNetwork network) {
        this.config = config != null ? config : new BayesConfig.ConfigRoot();
        if (network != null) {
            attach(network);
        }
    }

    @PostConstruct
    public void init() {
        if (isReady) {
            return;
        }
        String source = NetworkPathResolver.resolveNetworkFile(config);
        logger.info("Initializing Bayes network service from {}...", source);
        Path file = Paths.get(source);
        BayesianNetwork loaded = Files.isRegularFile(file) ? loader.loadFile(file) : loader.loadResource(source);
        attach(loaded);
    }

    private void attach(BayesianNetwork network) {
        lock.writeLock().lock();
        try {
            this.network = network;
            this.engine = InferenceEngineFactory.create(config.inference, network);
            this.analyzer = new IndependenceAnalyzer(network);
            this.isReady = true;
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Network ready: {} nodes, engine={}", network.size(), engine.getName());
    }

    public boolean isReady() {
        return isReady;
    }

    public InferenceResult query(String query) {
        return query(QueryParser.parse(query));
    }

    public InferenceResult query(ProbabilityQuery query) {
        return read(() -> engine.query(query));
    }

    public boolean isIndependent(Set<String> a, Set<String> b, Set<String> evidence) {
        IndependenceQuery query = new IndependenceQuery(a, b, evidence);
        return read(() -> analyzer.isIndependent(query));
    }

    public NetworkNode addNode(String name, NetworkDescriptionLoader.NodeDescription description) {
        lock.writeLock().lock();
        try {
            NetworkNode node = loader.toNode(name, description, network);
            network.addNode(node);
            logger.info("Added node {} with parents {}", name, node.getParentNames());
            return node;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @param policy null selects the configured default policy
     */
    public List<String> removeNode(String name, RemovalPolicy policy) {
        RemovalPolicy effective = policy != null ? policy : RemovalPolicy.fromString(config.removalPolicy);
        lock.writeLock().lock();
        try {
            List<String> removed = network.removeNode(name, effective);
            logger.info("Removed nodes {} ({})", removed, effective);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<String> topologicalOrder() {
        return read(() -> network.topologicalOrder());
    }

    public NodeSummary describe(String name) {
        return read(() -> {
            NetworkNode node = network.getNode(name);
            NodeSummary summary = new NodeSummary();
            summary.name = node.getName();
            summary.domain = node.getDomain();
            summary.parents = node.getParentNames();
            summary.children = network.children(name);
            return summary;
        });
    }

    /**
     * Deep copy of the current network, safe to use outside the lock.
     */
    public BayesianNetwork snapshot() {
        return read(() -> network.copy());
    }

    public String getEngineName() {
        return read(() -> engine.getName());
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
