package com.bayesai.server.ai.query;

import java.util.Objects;

/**
 * One term of a probability query: a variable name with an optional value.
 */
public final class QueryVariable {

    private final String name;
    private final String value;

    public QueryVariable(String name, String value) {
        this.name = name;
        this.value = value;
    }

    public static QueryVariable of(String name) {
        return new QueryVariable(name, null);
    }

    public static QueryVariable of(String name, String value) {
        return new QueryVariable(name, value);
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public boolean isValued() {
        return value != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryVariable)) {
            return false;
        }
        QueryVariable that = (QueryVariable) o;
        return Objects.equals(name, that.name) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return value == null ? name : name + "=" + value;
    }
}
