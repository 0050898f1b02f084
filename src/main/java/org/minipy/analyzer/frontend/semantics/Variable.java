package org.minipy.analyzer.frontend.semantics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A variable recorded by an assignment.
 *
 * @param name The variable name.
 * @param type The type inferred from the assigned expression.
 * @param line The line of the assignment that last defined the variable.
 */
public record Variable(
        @JsonProperty("name") String name,
        @JsonProperty("type") VariableType type,
        @JsonProperty("line") int line
) {
}
