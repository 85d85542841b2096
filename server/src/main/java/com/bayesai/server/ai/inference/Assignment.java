package com.bayesai.server.ai.inference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable ordered mapping from variable name to value, used as the key of a posterior
 * distribution.
 */
public final class Assignment {

    private final Map<String, String> values;

    public Assignment(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Assignment of(String name, String value) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put(name, value);
        return new Assignment(m);
    }

    public String get(String name) {
        return values.get(name);
    }

    public Map<String, String> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Assignment && values.equals(((Assignment) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
    }
}
