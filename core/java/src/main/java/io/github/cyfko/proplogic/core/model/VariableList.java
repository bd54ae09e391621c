package io.github.cyfko.proplogic.core.model;

import io.github.cyfko.proplogic.core.exception.LogicValidationException;
import io.github.cyfko.proplogic.core.utils.VariableValidationUtils;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered sequence of distinct variable names.
 * <p>
 * The order is significant: it defines the column order of a truth table and the enumeration order
 * of its rows (the first variable toggles slowest). Two lists are equal only if they hold the same
 * names in the same order.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class VariableList {

    private final List<String> names;

    private VariableList(List<String> names) {
        this.names = names;
    }

    /**
     * @param names variable names in column order
     * @return the validated list
     * @throws LogicValidationException if the list is empty, holds duplicates or invalid names
     */
    public static VariableList of(List<String> names) {
        VariableValidationUtils.validate(names).throwIfInvalid();
        return new VariableList(List.copyOf(names));
    }

    public static VariableList of(String... names) {
        return of(Arrays.asList(names));
    }

    public List<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public String get(int index) {
        return names.get(index);
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableList)) return false;
        return names.equals(((VariableList) o).names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
