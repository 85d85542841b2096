package com.bayesai.server.ai.network;

import com.bayesai.server.ai.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conditional probability table of one variable given its parents.
 * <p>
 * Rows are stored in a flat array indexed by the mixed-radix encoding of
 * (parent-value_1, ..., parent-value_k, own-value), with the own value as the least
 * significant digit. Each block of {@code ownVariable.size()} consecutive entries is one
 * parent row and sums to 1 within {@link #ROW_SUM_TOLERANCE}.
 */
public final class ConditionalProbabilityTable {

    public static final double ROW_SUM_TOLERANCE = 1e-6;

    private final RandomVariable ownVariable;
    private final List<RandomVariable> parentVariables;
    // strides[i] is the weight of key position i; the own variable has stride 1
    private final int[] strides;
    private final double[] probabilities;

    /**
     * Builds and validates a table from rows keyed by canonical assignment keys such as
     * {@code (t,f,t)}: parent values in declaration order followed by the own value, no
     * whitespace.
     *
     * @throws ValidationException naming the offending key when a key has the wrong arity,
     *                             references a value outside its domain, carries an invalid
     *                             probability, when a combination is missing, or when a
     *                             parent row does not sum to 1
     */
    public ConditionalProbabilityTable(RandomVariable ownVariable, List<RandomVariable> parentVariables,
            Map<String, Double> rows) {
        this.ownVariable = ownVariable;
        this.parentVariables = Collections.unmodifiableList(new ArrayList<>(parentVariables));
        this.strides = computeStrides(ownVariable, this.parentVariables);

        int size = strides[0] * variableAt(0).size();
        this.probabilities = new double[size];
        boolean[] filled = new boolean[size];

        if (rows == null) {
            throw new ValidationException(ownVariable.getName(),
                    "Node " + ownVariable.getName() + " has no probabilities");
        }

        for (Map.Entry<String, Double> row : rows.entrySet()) {
            String key = row.getKey();
            int index = indexOfKey(key);
            Double p = row.getValue();
            if (p == null || p.isNaN() || p < 0.0 || p > 1.0) {
                throw new ValidationException(key, "Probability " + p + " for " + key + " of node "
                        + ownVariable.getName() + " is not in [0,1]");
            }
            if (filled[index]) {
                throw new ValidationException(key, "Duplicate probability " + key + " for node "
                        + ownVariable.getName());
            }
            filled[index] = true;
            probabilities[index] = p;
        }

        for (int i = 0; i < size; i++) {
            if (!filled[i]) {
                String missing = keyOfIndex(i);
                throw new ValidationException(missing, "Missing probability " + missing
                        + " for node " + ownVariable.getName());
            }
        }

        int rowWidth = ownVariable.size();
        for (int start = 0; start < size; start += rowWidth) {
            double sum = 0.0;
            for (int j = 0; j < rowWidth; j++) {
                sum += probabilities[start + j];
            }
            if (Math.abs(sum - 1.0) > ROW_SUM_TOLERANCE) {
                String rowKey = keyOfIndex(start);
                throw new ValidationException(rowKey, String.format(
                        "Probabilities of node %s for parent row starting at %s sum to %.9f, expected 1",
                        ownVariable.getName(), rowKey, sum));
            }
        }
    }

    private ConditionalProbabilityTable(ConditionalProbabilityTable other) {
        this.ownVariable = other.ownVariable;
        this.parentVariables = other.parentVariables;
        this.strides = other.strides.clone();
        this.probabilities = other.probabilities.clone();
    }

    private static int[] computeStrides(RandomVariable own, List<RandomVariable> parents) {
        int arity = parents.size() + 1;
        int[] strides = new int[arity];
        int stride = 1;
        for (int i = arity - 1; i >= 0; i--) {
            strides[i] = stride;
            RandomVariable v = i == arity - 1 ? own : parents.get(i);
            stride *= v.size();
        }
        return strides;
    }

    private RandomVariable variableAt(int position) {
        return position == parentVariables.size() ? ownVariable : parentVariables.get(position);
    }

    private int indexOfKey(String key) {
        if (key == null || key.length() < 2 || key.charAt(0) != '(' || key.charAt(key.length() - 1) != ')') {
            throw new ValidationException(String.valueOf(key), "Unexpected probability key " + key
                    + " for node " + ownVariable.getName());
        }
        String[] values = key.substring(1, key.length() - 1).split(",", -1);
        if (values.length != strides.length) {
            throw new ValidationException(key, "Unexpected probability " + key + " for node "
                    + ownVariable.getName() + ", expected " + strides.length + " values");
        }
        int index = 0;
        for (int i = 0; i < values.length; i++) {
            RandomVariable v = variableAt(i);
            int valueIdx = v.indexOf(values[i]);
            if (valueIdx < 0) {
                throw new ValidationException(key, "Value '" + values[i] + "' in " + key
                        + " is outside the domain of " + v.getName());
            }
            index += valueIdx * strides[i];
        }
        return index;
    }

    private String keyOfIndex(int index) {
        List<String> values = new ArrayList<>(strides.length);
        int rest = index;
        for (int i = 0; i < strides.length; i++) {
            int valueIdx = rest / strides[i];
            rest %= strides[i];
            values.add(variableAt(i).valueAt(valueIdx));
        }
        return canonicalKey(values);
    }

    /**
     * Canonical key of an assignment: {@code (v1,v2,...)}.
     */
    public static String canonicalKey(List<String> values) {
        return "(" + String.join(",", values) + ")";
    }

    /**
     * O(1) lookup by domain indices.
     *
     * @param parentValueIndices index of each parent's value, in parent declaration order
     * @param ownValueIndex      index of the own value
     */
    public double lookup(int[] parentValueIndices, int ownValueIndex) {
        if (parentValueIndices.length != parentVariables.size()) {
            throw new ValidationException(ownVariable.getName(), "Lookup on " + ownVariable.getName()
                    + " needs " + parentVariables.size() + " parent values, got " + parentValueIndices.length);
        }
        int index = ownValueIndex;
        for (int i = 0; i < parentValueIndices.length; i++) {
            index += parentValueIndices[i] * strides[i];
        }
        return probabilities[index];
    }

    /**
     * Lookup by value labels: parent values in declaration order followed by the own value.
     */
    public double lookup(List<String> values) {
        if (values.size() != strides.length) {
            throw new ValidationException(canonicalKey(values), "Incomplete assignment "
                    + canonicalKey(values) + " for node " + ownVariable.getName());
        }
        return probabilities[indexOfKey(canonicalKey(values))];
    }

    public RandomVariable getOwnVariable() {
        return ownVariable;
    }

    public List<RandomVariable> getParentVariables() {
        return parentVariables;
    }

    public int getParentRowCount() {
        return probabilities.length / ownVariable.size();
    }

    /**
     * All rows keyed canonically, in enumeration order.
     */
    public Map<String, Double> toRows() {
        Map<String, Double> rows = new LinkedHashMap<>();
        for (int i = 0; i < probabilities.length; i++) {
            rows.put(keyOfIndex(i), probabilities[i]);
        }
        return rows;
    }

    public ConditionalProbabilityTable copy() {
        return new ConditionalProbabilityTable(this);
    }
}
