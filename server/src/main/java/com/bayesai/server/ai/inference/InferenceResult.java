package com.bayesai.server.ai.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Answer to a probability query. A fully valued target yields a single probability;
 * otherwise the result is a distribution keyed by assignments of the open target variables,
 * in target declaration order and domain order.
 */
public class InferenceResult {
    private final Map<Assignment, Double> distribution;
    private final boolean singleValue;
    private final double evidenceProbability;
    private final int hiddenCount;
    private final String engineUsed;

    public InferenceResult(Map<Assignment, Double> distribution, boolean singleValue, double evidenceProbability,
            int hiddenCount, String engineUsed) {
        this.distribution = Collections.unmodifiableMap(new LinkedHashMap<>(distribution));
        this.singleValue = singleValue;
        this.evidenceProbability = evidenceProbability;
        this.hiddenCount = hiddenCount;
        this.engineUsed = engineUsed;
    }

    public boolean isSingleValue() {
        return singleValue;
    }

    /**
     * @throws IllegalStateException if the query left a target variable open
     */
    public double getProbability() {
        if (!singleValue) {
            throw new IllegalStateException("Query has open target variables, use getDistribution()");
        }
        return distribution.values().iterator().next();
    }

    public Map<Assignment, Double> getDistribution() {
        return distribution;
    }

    /**
     * Probability of the given open-target values, in target declaration order.
     */
    public double probabilityOf(Assignment assignment) {
        Double p = distribution.get(assignment);
        if (p == null) {
            throw new IllegalArgumentException("No entry for assignment " + assignment);
        }
        return p;
    }

    /**
     * P(evidence), or 1.0 when the query had no evidence.
     */
    public double getEvidenceProbability() {
        return evidenceProbability;
    }

    public int getHiddenCount() {
        return hiddenCount;
    }

    public String getEngineUsed() {
        return engineUsed;
    }

    public Assignment getMostProbable() {
        List<Assignment> keys = new ArrayList<>(distribution.keySet());
        return keys.get(MathUtil.argmax(values()));
    }

    public double getEntropy() {
        return MathUtil.entropy(values());
    }

    private double[] values() {
        double[] v = new double[distribution.size()];
        int i = 0;
        for (double p : distribution.values()) {
            v[i++] = p;
        }
        return v;
    }

    @Override
    public String toString() {
        return "InferenceResult{" +
                (singleValue ? "p=" + String.format("%.8f", getProbability()) : "distribution=" + distribution) +
                ", hidden=" + hiddenCount +
                ", engine='" + engineUsed + '\'' +
                '}';
    }
}
