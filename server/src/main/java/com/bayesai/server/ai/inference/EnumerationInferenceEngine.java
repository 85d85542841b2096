package com.bayesai.server.ai.inference;

import com.bayesai.server.ai.exception.EnumerationLimitExceededException;
import com.bayesai.server.ai.exception.QuerySemanticException;
import com.bayesai.server.ai.exception.ZeroEvidenceProbabilityException;
import com.bayesai.server.ai.network.BayesianNetwork;
import com.bayesai.server.ai.network.NetworkNode;
import com.bayesai.server.ai.network.RandomVariable;
import com.bayesai.server.ai.query.ProbabilityQuery;
import com.bayesai.server.ai.query.QueryVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exact inference by enumeration: every hidden variable is summed out of the full joint
 * distribution, evaluated as the product of each node's table entry in topological order.
 * <p>
 * The engine only reads the network and keeps all scratch state on the stack of the call,
 * so concurrent queries against an unchanging network are safe.
 */
public class EnumerationInferenceEngine implements InferenceEngine {

    private static final Logger logger = LoggerFactory.getLogger(EnumerationInferenceEngine.class);

    protected final BayesianNetwork network;
    private final Integer maxHiddenVariables;

    public EnumerationInferenceEngine(BayesianNetwork network) {
        this(network, null);
    }

    /**
     * @param maxHiddenVariables queries needing more hidden variables are rejected; null for
     *                           no limit
     */
    public EnumerationInferenceEngine(BayesianNetwork network, Integer maxHiddenVariables) {
        this.network = network;
        this.maxHiddenVariables = maxHiddenVariables;
    }

    @Override
    public String getName() {
        return "enumeration";
    }

    @Override
    public InferenceResult query(ProbabilityQuery query) {
        validate(query);

        int n = network.size();
        int[] values = new int[n];
        Arrays.fill(values, -1);

        Set<Integer> queryIds = new HashSet<>();
        List<Integer> openTargets = new ArrayList<>();
        for (QueryVariable t : query.getTargets()) {
            int id = network.idOf(t.getName());
            queryIds.add(id);
            if (t.isValued()) {
                values[id] = network.nodeAt(id).getVariable().indexOf(t.getValue());
            } else {
                openTargets.add(id);
            }
        }
        for (QueryVariable e : query.getEvidence()) {
            int id = network.idOf(e.getName());
            queryIds.add(id);
            values[id] = network.nodeAt(id).getVariable().indexOf(e.getValue());
        }

        int[] order = calculationOrder(queryIds);
        int hiddenCount = order.length - countIn(order, queryIds);
        if (maxHiddenVariables != null && hiddenCount > maxHiddenVariables) {
            throw new EnumerationLimitExceededException(query.toString(), hiddenCount, maxHiddenVariables);
        }
        int[][] parentScratch = parentScratch(order);

        // One weight per combination of the open targets, in declaration and domain order.
        List<Assignment> keys = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        int[] radix = new int[openTargets.size()];
        for (int i = 0; i < radix.length; i++) {
            radix[i] = network.nodeAt(openTargets.get(i)).getVariable().size();
        }
        int[] counter = new int[radix.length];
        do {
            Map<String, String> key = new LinkedHashMap<>();
            for (int i = 0; i < counter.length; i++) {
                int id = openTargets.get(i);
                values[id] = counter[i];
                RandomVariable v = network.nodeAt(id).getVariable();
                key.put(v.getName(), v.valueAt(counter[i]));
            }
            keys.add(openTargets.isEmpty() ? fullTargetKey(query) : new Assignment(key));
            weights.add(enumerate(order, 0, values, parentScratch));
        } while (increment(counter, radix));

        double evidenceProbability = 1.0;
        if (query.hasEvidence()) {
            // P(evidence): every target becomes hidden
            for (QueryVariable t : query.getTargets()) {
                values[network.idOf(t.getName())] = -1;
            }
            evidenceProbability = enumerate(order, 0, values, parentScratch);
            if (evidenceProbability == 0.0) {
                throw new ZeroEvidenceProbabilityException(evidenceKey(query));
            }
        }

        double[] raw = new double[weights.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = weights.get(i);
        }

        // A posterior over open targets sums to 1; a fully valued target is divided by P(evidence).
        double denominator = evidenceProbability;
        if (query.hasEvidence() && !openTargets.isEmpty()) {
            denominator = MathUtil.sum(raw);
            if (denominator == 0.0) {
                throw new ZeroEvidenceProbabilityException(evidenceKey(query) + "," + fixedTargetKey(query));
            }
        }
        double[] probs = MathUtil.normalize(raw, denominator);

        Map<Assignment, Double> distribution = new LinkedHashMap<>();
        for (int i = 0; i < probs.length; i++) {
            distribution.put(keys.get(i), probs[i]);
        }

        logger.debug("Query {} : open={}, hidden={}, P(evidence)={}, normaliser={}", query, openTargets.size(),
                hiddenCount, evidenceProbability, denominator);
        return new InferenceResult(distribution, openTargets.isEmpty(), evidenceProbability, hiddenCount,
                getName());
    }

    /**
     * Node ids to include in the product, in topological order. Every id in
     * {@code queryIds} must be present and every parent of an included node must precede it.
     */
    protected int[] calculationOrder(Set<Integer> queryIds) {
        return network.topologicalIds();
    }

    /**
     * Recursive sum over the hidden variables at and after {@code pos}. Assigned variables
     * contribute their table entry; unassigned ones are summed over their domain.
     */
    private double enumerate(int[] order, int pos, int[] values, int[][] parentScratch) {
        if (pos == order.length) {
            return 1.0;
        }
        int id = order[pos];
        NetworkNode node = network.nodeAt(id);
        int[] parents = network.parentIdsOf(id);
        int[] parentValues = parentScratch[pos];
        for (int i = 0; i < parents.length; i++) {
            parentValues[i] = values[parents[i]];
        }

        if (values[id] >= 0) {
            double p = node.getCpt().lookup(parentValues, values[id]);
            if (p == 0.0) {
                return 0.0;
            }
            return p * enumerate(order, pos + 1, values, parentScratch);
        }

        double sum = 0.0;
        int domainSize = node.getVariable().size();
        for (int v = 0; v < domainSize; v++) {
            double p = node.getCpt().lookup(parentValues, v);
            if (p == 0.0) {
                continue;
            }
            values[id] = v;
            sum += p * enumerate(order, pos + 1, values, parentScratch);
        }
        values[id] = -1;

        if (logger.isTraceEnabled()) {
            logger.trace("Summed out {} at depth {}: {}", node.getName(), pos, sum);
        }
        return sum;
    }

    private int[][] parentScratch(int[] order) {
        int[][] scratch = new int[order.length][];
        for (int i = 0; i < order.length; i++) {
            scratch[i] = new int[network.parentIdsOf(order[i]).length];
        }
        return scratch;
    }

    private static boolean increment(int[] counter, int[] radix) {
        for (int i = counter.length - 1; i >= 0; i--) {
            if (++counter[i] < radix[i]) {
                return true;
            }
            counter[i] = 0;
        }
        return false;
    }

    private static int countIn(int[] order, Set<Integer> ids) {
        int c = 0;
        for (int id : order) {
            if (ids.contains(id)) {
                c++;
            }
        }
        return c;
    }

    private static Assignment fullTargetKey(ProbabilityQuery query) {
        Map<String, String> key = new LinkedHashMap<>();
        for (QueryVariable t : query.getTargets()) {
            key.put(t.getName(), t.getValue());
        }
        return new Assignment(key);
    }

    private static String fixedTargetKey(ProbabilityQuery query) {
        List<String> terms = new ArrayList<>();
        for (QueryVariable t : query.getTargets()) {
            if (t.isValued()) {
                terms.add(t.toString());
            }
        }
        return String.join(",", terms);
    }

    private static String evidenceKey(ProbabilityQuery query) {
        List<String> terms = new ArrayList<>();
        for (QueryVariable e : query.getEvidence()) {
            terms.add(e.toString());
        }
        return String.join(",", terms);
    }

    /**
     * Checks the query against the network: known names, values in domain, valued evidence,
     * and no variable named twice across targets and evidence.
     */
    protected void validate(ProbabilityQuery query) {
        if (query.getTargets().isEmpty()) {
            throw new QuerySemanticException("", "Query needs at least one target variable");
        }
        Set<String> seen = new HashSet<>();
        for (QueryVariable t : query.getTargets()) {
            checkTerm(t, seen);
        }
        for (QueryVariable e : query.getEvidence()) {
            if (!e.isValued()) {
                throw new QuerySemanticException(e.getName(), "Evidence variable " + e.getName() + " has no value");
            }
            checkTerm(e, seen);
        }
    }

    private void checkTerm(QueryVariable term, Set<String> seen) {
        String name = term.getName();
        if (!seen.add(name)) {
            throw new QuerySemanticException(name, "Variable " + name + " appears more than once in the query");
        }
        if (!network.contains(name)) {
            throw new QuerySemanticException(name, "Variable " + name + " is not in the network");
        }
        if (term.isValued() && !network.getNode(name).getVariable().contains(term.getValue())) {
            throw new QuerySemanticException(name, "Value '" + term.getValue() + "' is not in the domain of "
                    + name + " " + network.getNode(name).getDomain());
        }
    }
}
