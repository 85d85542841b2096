package com.bayesai.server.controller;

import com.bayesai.server.ai.exception.BayesNetworkException;
import com.bayesai.server.ai.exception.StructuralException;
import com.bayesai.server.ai.exception.UnknownNodeException;
import com.bayesai.server.ai.inference.Assignment;
import com.bayesai.server.ai.inference.InferenceResult;
import com.bayesai.server.ai.loader.NetworkDescriptionLoader;
import com.bayesai.server.ai.network.RemovalPolicy;
import com.bayesai.server.service.BayesNetworkService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
public class NetworkController {

    private static final Logger logger = LoggerFactory.getLogger(NetworkController.class);
    private final BayesNetworkService networkService;

    public NetworkController(BayesNetworkService networkService) {
        this.networkService = networkService;
    }

    public static class ProbabilityRequest {
        public String query;
    }

    public static class IndependenceRequest {
        public List<String> a;
        public List<String> b;
        public List<String> evidence;
    }

    public static class AddNodeRequest {
        public String name;
        public NetworkDescriptionLoader.NodeDescription node;
    }

    public static class ProbabilityResponse {
        public String query;
        public Double probability;
        public Map<String, Double> distribution;
        public int hiddenVariables;
        public String engine;
    }

    @PostMapping("/probability")
    public ResponseEntity<?> probability(@RequestBody ProbabilityRequest request) {
        if (!networkService.isReady()) {
            return notReady();
        }
        if (request == null || request.query == null || request.query.trim().isEmpty()) {
            return ResponseEntity.badRequest().body("Query must not be empty.");
        }

        logger.info("Received probability query '{}'", request.query);
        InferenceResult result = networkService.query(request.query);

        ProbabilityResponse response = new ProbabilityResponse();
        response.query = request.query;
        response.hiddenVariables = result.getHiddenCount();
        response.engine = result.getEngineUsed();
        if (result.isSingleValue()) {
            response.probability = result.getProbability();
        } else {
            response.distribution = new LinkedHashMap<>();
            for (Map.Entry<Assignment, Double> e : result.getDistribution().entrySet()) {
                response.distribution.put(e.getKey().toString(), e.getValue());
            }
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/independence")
    public ResponseEntity<?> independence(@RequestBody IndependenceRequest request) {
        if (!networkService.isReady()) {
            return notReady();
        }
        if (request == null || request.a == null || request.b == null) {
            return ResponseEntity.badRequest().body("Both variable sets 'a' and 'b' are required.");
        }
        Set<String> evidence = request.evidence != null ? Set.copyOf(request.evidence) : Set.of();
        boolean independent = networkService.isIndependent(Set.copyOf(request.a), Set.copyOf(request.b), evidence);
        return ResponseEntity.ok(Map.of("independent", independent));
    }

    @GetMapping("/network/topology")
    public ResponseEntity<?> topology() {
        if (!networkService.isReady()) {
            return notReady();
        }
        return ResponseEntity.ok(networkService.topologicalOrder());
    }

    @GetMapping("/network/nodes/{name}")
    public ResponseEntity<?> node(@PathVariable("name") String name) {
        if (!networkService.isReady()) {
            return notReady();
        }
        return ResponseEntity.ok(networkService.describe(name));
    }

    @PostMapping("/network/nodes")
    public ResponseEntity<?> addNode(@RequestBody AddNodeRequest request) {
        if (!networkService.isReady()) {
            return notReady();
        }
        if (request == null || request.name == null || request.node == null) {
            return ResponseEntity.badRequest().body("Node name and description are required.");
        }
        networkService.addNode(request.name, request.node);
        return ResponseEntity.status(HttpStatus.CREATED).body(networkService.describe(request.name));
    }

    @DeleteMapping("/network/nodes/{name}")
    public ResponseEntity<?> removeNode(@PathVariable("name") String name,
            @RequestParam(value = "cascade", required = false) Boolean cascade) {
        if (!networkService.isReady()) {
            return notReady();
        }
        RemovalPolicy policy = cascade == null ? null : (cascade ? RemovalPolicy.CASCADE : RemovalPolicy.REJECT);
        return ResponseEntity.ok(Map.of("removed", networkService.removeNode(name, policy)));
    }

    @ExceptionHandler(UnknownNodeException.class)
    public ResponseEntity<String> handleUnknownNode(UnknownNodeException e) {
        logger.warn("No node named {}", e.getIdentifier());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
    }

    @ExceptionHandler(StructuralException.class)
    public ResponseEntity<String> handleStructural(StructuralException e) {
        logger.warn("Rejected structural change on {}: {}", e.getIdentifier(), e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
    }

    @ExceptionHandler(BayesNetworkException.class)
    public ResponseEntity<String> handleBayes(BayesNetworkException e) {
        logger.warn("Rejected request on {}: {}", e.getIdentifier(), e.getMessage());
        return ResponseEntity.badRequest().body(e.getMessage());
    }

    private static ResponseEntity<String> notReady() {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body("Network is still loading, please try again later.");
    }
}
