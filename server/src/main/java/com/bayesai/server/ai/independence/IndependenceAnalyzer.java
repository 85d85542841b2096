package com.bayesai.server.ai.independence;

import com.bayesai.server.ai.exception.QuerySemanticException;
import com.bayesai.server.ai.network.BayesianNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides conditional independence by D-separation on the moralized ancestral graph:
 * <ol>
 * <li>keep A, B, E and all their ancestors;</li>
 * <li>marry every pair of parents that share a child, then drop edge directions;</li>
 * <li>delete the evidence nodes;</li>
 * <li>A and B are independent given E iff no node of B is reachable from A.</li>
 * </ol>
 * No joint distribution is built. Reachability in an undirected graph is symmetric, so
 * swapping A and B never changes the answer.
 */
public class IndependenceAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(IndependenceAnalyzer.class);

    private final BayesianNetwork network;

    public IndependenceAnalyzer(BayesianNetwork network) {
        this.network = network;
    }

    public boolean isIndependent(Set<String> a, Set<String> b) {
        return isIndependent(new IndependenceQuery(a, b, Set.of()));
    }

    public boolean isIndependent(Set<String> a, Set<String> b, Set<String> evidence) {
        return isIndependent(new IndependenceQuery(a, b, evidence));
    }

    public boolean isIndependent(IndependenceQuery query) {
        validate(query);

        Set<String> ancestral = new HashSet<>();
        for (Set<String> group : List.of(query.getA(), query.getB(), query.getEvidence())) {
            for (String name : group) {
                ancestral.add(name);
                ancestral.addAll(network.ancestors(name));
            }
        }

        Map<String, Set<String>> moral = new HashMap<>();
        for (String name : ancestral) {
            moral.computeIfAbsent(name, k -> new HashSet<>());
        }
        for (String child : ancestral) {
            // parents of a node in an ancestral set are in the set too
            List<String> parents = network.parents(child);
            for (String parent : parents) {
                link(moral, parent, child);
            }
            for (int i = 0; i < parents.size(); i++) {
                for (int j = i + 1; j < parents.size(); j++) {
                    link(moral, parents.get(i), parents.get(j));
                }
            }
        }

        Set<String> blocked = query.getEvidence();
        Set<String> visited = new HashSet<>(query.getA());
        Deque<String> queue = new ArrayDeque<>(query.getA());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (query.getB().contains(current)) {
                logger.debug("{} : dependent, reached {}", query, current);
                return false;
            }
            for (String next : moral.get(current)) {
                if (!blocked.contains(next) && visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        logger.debug("{} : independent", query);
        return true;
    }

    private static void link(Map<String, Set<String>> graph, String x, String y) {
        graph.get(x).add(y);
        graph.get(y).add(x);
    }

    private void validate(IndependenceQuery query) {
        if (query.getA().isEmpty() || query.getB().isEmpty()) {
            throw new QuerySemanticException("", "Independence query needs non-empty variable sets, got " + query);
        }
        List<Set<String>> groups = List.of(query.getA(), query.getB(), query.getEvidence());
        for (Set<String> group : groups) {
            for (String name : group) {
                if (!network.contains(name)) {
                    throw new QuerySemanticException(name, "Variable " + name + " is not in the network");
                }
            }
        }
        Set<String> seen = new HashSet<>();
        List<String> all = new ArrayList<>();
        groups.forEach(all::addAll);
        for (String name : all) {
            if (!seen.add(name)) {
                throw new QuerySemanticException(name, "Variable " + name
                        + " appears in more than one set of the independence query");
            }
        }
    }
}
