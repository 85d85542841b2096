package com.bayesai.server.ai.network;

import com.bayesai.server.ai.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A random variable together with its ordered parents and its conditional probability
 * table. Nodes are validated completely at construction, so a malformed table never
 * reaches a network or a query.
 */
public final class NetworkNode {

    private final RandomVariable variable;
    private final List<RandomVariable> parents;
    private final List<String> parentNames;
    private final ConditionalProbabilityTable cpt;

    public NetworkNode(String name, List<String> domain, List<RandomVariable> parents,
            Map<String, Double> probabilities) {
        this(new RandomVariable(name, domain), parents, probabilities);
    }

    public NetworkNode(RandomVariable variable, List<RandomVariable> parents, Map<String, Double> probabilities) {
        this.variable = variable;
        this.parents = Collections.unmodifiableList(new ArrayList<>(parents != null ? parents : List.of()));

        List<String> names = new ArrayList<>(this.parents.size());
        Set<String> seen = new HashSet<>();
        for (RandomVariable parent : this.parents) {
            if (!seen.add(parent.getName())) {
                throw new ValidationException(parent.getName(), "Node " + variable.getName()
                        + " lists parent " + parent.getName() + " more than once");
            }
            names.add(parent.getName());
        }
        this.parentNames = Collections.unmodifiableList(names);
        this.cpt = new ConditionalProbabilityTable(variable, this.parents, probabilities);
    }

    private NetworkNode(NetworkNode other) {
        this.variable = other.variable;
        this.parents = other.parents;
        this.parentNames = other.parentNames;
        this.cpt = other.cpt.copy();
    }

    public String getName() {
        return variable.getName();
    }

    public RandomVariable getVariable() {
        return variable;
    }

    public List<String> getDomain() {
        return variable.getDomain();
    }

    public List<RandomVariable> getParents() {
        return parents;
    }

    public List<String> getParentNames() {
        return parentNames;
    }

    public ConditionalProbabilityTable getCpt() {
        return cpt;
    }

    /**
     * Probability of the node taking {@code value} given the parent values in
     * {@code assignment}, which must cover every parent.
     */
    public double probability(Map<String, String> assignment, String value) {
        List<String> key = new ArrayList<>(parents.size() + 1);
        for (String parent : parentNames) {
            String parentValue = assignment.get(parent);
            if (parentValue == null) {
                throw new ValidationException(parent, "Assignment for node " + getName()
                        + " lacks a value for parent " + parent);
            }
            key.add(parentValue);
        }
        key.add(value);
        return cpt.lookup(key);
    }

    /**
     * Independent deep copy; tables are not shared with the original.
     */
    public NetworkNode copy() {
        return new NetworkNode(this);
    }

    @Override
    public String toString() {
        return "NetworkNode{" + getName() + ", domain=" + getDomain() + ", parents=" + parentNames + '}';
    }
}
