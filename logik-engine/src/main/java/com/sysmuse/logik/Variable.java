package com.sysmuse.logik;

import java.util.Objects;

/**
 * An atomic proposition. Within a statement a variable is identified by its name alone,
 * so two variables with the same name are equal.
 */
public final class Variable implements Comparable<Variable> {

    private final String name;

    public Variable(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be blank");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(Variable other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        return name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
