package org.minipy.analyzer.frontend.semantics;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The inferred type of a variable or expression.
 */
public enum VariableType {
    INT("int"),
    STRING("string"),
    BOOL("bool"),
    UNKNOWN("unknown");

    private final String wireName;

    VariableType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Gets the lowercase name used in reports.
     * @return The wire name.
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
