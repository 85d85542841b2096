package com.bayesai.server.ai.inference;

import com.bayesai.server.ai.network.BayesianNetwork;

import java.util.HashSet;
import java.util.Set;

/**
 * Enumeration restricted to the query variables and their ancestors. Every other node is
 * barren with respect to the query and sums out to 1, so results match
 * {@link EnumerationInferenceEngine} while fewer variables are enumerated.
 */
public class AncestralInferenceEngine extends EnumerationInferenceEngine {

    public AncestralInferenceEngine(BayesianNetwork network, Integer maxHiddenVariables) {
        super(network, maxHiddenVariables);
    }

    @Override
    public String getName() {
        return "ancestral";
    }

    @Override
    protected int[] calculationOrder(Set<Integer> queryIds) {
        Set<String> keep = new HashSet<>();
        for (int id : queryIds) {
            String name = network.nodeAt(id).getName();
            keep.add(name);
            keep.addAll(network.ancestors(name));
        }
        int[] full = network.topologicalIds();
        int[] order = new int[keep.size()];
        int k = 0;
        for (int id : full) {
            if (keep.contains(network.nodeAt(id).getName())) {
                order[k++] = id;
            }
        }
        return order;
    }
}
