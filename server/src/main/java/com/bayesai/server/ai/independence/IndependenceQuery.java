package com.bayesai.server.ai.independence;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Asks whether variable set A is independent of set B given evidence set E.
 */
public final class IndependenceQuery {

    private final Set<String> a;
    private final Set<String> b;
    private final Set<String> evidence;

    public IndependenceQuery(Set<String> a, Set<String> b, Set<String> evidence) {
        this.a = Collections.unmodifiableSet(new LinkedHashSet<>(a));
        this.b = Collections.unmodifiableSet(new LinkedHashSet<>(b));
        this.evidence = Collections.unmodifiableSet(new LinkedHashSet<>(evidence != null ? evidence : Set.of()));
    }

    public static IndependenceQuery of(String a, String b, String... evidence) {
        return new IndependenceQuery(Set.of(a), Set.of(b), Set.of(evidence));
    }

    public Set<String> getA() {
        return a;
    }

    public Set<String> getB() {
        return b;
    }

    public Set<String> getEvidence() {
        return evidence;
    }

    /**
     * The same question with A and B swapped.
     */
    public IndependenceQuery swapped() {
        return new IndependenceQuery(b, a, evidence);
    }

    @Override
    public String toString() {
        return a + " _|_ " + b + " | " + evidence;
    }
}
