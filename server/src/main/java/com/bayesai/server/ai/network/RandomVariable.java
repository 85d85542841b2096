package com.bayesai.server.ai.network;

import com.bayesai.server.ai.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named discrete variable with an ordered domain of value labels. The order only fixes
 * enumeration order; the domain is semantically a set.
 */
public final class RandomVariable {

    private final String name;
    private final List<String> domain;
    private final Map<String, Integer> indexByValue;

    public RandomVariable(String name, List<String> domain) {
        if (name == null || name.trim().isEmpty()) {
            throw new ValidationException(String.valueOf(name), "Variable name must not be empty");
        }
        if (domain == null || domain.isEmpty()) {
            throw new ValidationException(name, "Variable " + name + " should have at least one value");
        }
        this.name = name;
        this.domain = Collections.unmodifiableList(new ArrayList<>(domain));
        this.indexByValue = new HashMap<>();
        for (int i = 0; i < domain.size(); i++) {
            String value = domain.get(i);
            if (value == null || value.isEmpty()) {
                throw new ValidationException(name, "Variable " + name + " has an empty value label");
            }
            if (!isKeySafe(value)) {
                throw new ValidationException(name, "Variable " + name + " has value label '" + value
                        + "' which cannot appear in a probability key");
            }
            if (indexByValue.put(value, i) != null) {
                throw new ValidationException(name, "Variable " + name + " lists value '" + value + "' twice");
            }
        }
    }

    // labels are joined as "(v1,v2,...)" in table keys
    private static boolean isKeySafe(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == ',' || c == '(' || c == ')' || Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    public String getName() {
        return name;
    }

    public List<String> getDomain() {
        return domain;
    }

    public int size() {
        return domain.size();
    }

    /**
     * @return position of the value in the domain, or -1 when the value is not in the domain
     */
    public int indexOf(String value) {
        Integer idx = indexByValue.get(value);
        return idx != null ? idx : -1;
    }

    public boolean contains(String value) {
        return indexByValue.containsKey(value);
    }

    public String valueAt(int index) {
        return domain.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RandomVariable)) {
            return false;
        }
        RandomVariable that = (RandomVariable) o;
        return name.equals(that.name) && domain.equals(that.domain);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, domain);
    }

    @Override
    public String toString() {
        return name + domain;
    }
}
