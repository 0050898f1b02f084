package org.minipy.analyzer.frontend.semantics;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The variables of one analyzed program.
 * <p>
 * There is a single flat scope for the whole program: assignments inside function bodies
 * and if blocks land in the same table, and function parameters are never entered.
 * A later assignment to a name replaces the earlier entry.
 */
public class VariableTable {

    private final Map<String, Variable> variables = new HashMap<>();

    /**
     * Defines or redefines a variable.
     * @param variable The variable to record.
     */
    public void define(Variable variable) {
        variables.put(variable.name(), variable);
    }

    /**
     * Resolves a variable by name.
     * @param name The name to look up.
     * @return The variable, or empty if no assignment to it has been seen yet.
     */
    public Optional<Variable> resolve(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    /**
     * Returns a copy of the table sorted by variable name.
     * @return An unmodifiable, sorted snapshot.
     */
    public SortedMap<String, Variable> snapshot() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(variables));
    }
}
