package com.bayesai.server.ai.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured form of {@code P(targets | evidence)}. Targets may be valued or left open;
 * evidence terms are expected to carry values. Only the shape is held here, semantic checks
 * against a network belong to the inference engine.
 */
public final class ProbabilityQuery {

    private final List<QueryVariable> targets;
    private final List<QueryVariable> evidence;

    public ProbabilityQuery(List<QueryVariable> targets, List<QueryVariable> evidence) {
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
        this.evidence = Collections.unmodifiableList(new ArrayList<>(evidence != null ? evidence : List.of()));
    }

    public static ProbabilityQuery of(List<QueryVariable> targets) {
        return new ProbabilityQuery(targets, List.of());
    }

    public List<QueryVariable> getTargets() {
        return targets;
    }

    public List<QueryVariable> getEvidence() {
        return evidence;
    }

    public boolean hasEvidence() {
        return !evidence.isEmpty();
    }

    public boolean isFullyValued() {
        return targets.stream().allMatch(QueryVariable::isValued);
    }

    @Override
    public String toString() {
        String t = targets.stream().map(QueryVariable::toString).collect(Collectors.joining(","));
        if (evidence.isEmpty()) {
            return t;
        }
        return t + "|" + evidence.stream().map(QueryVariable::toString).collect(Collectors.joining(","));
    }
}
