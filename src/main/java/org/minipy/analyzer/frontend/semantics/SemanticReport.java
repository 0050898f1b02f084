package org.minipy.analyzer.frontend.semantics;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.minipy.analyzer.diagnostics.DiagnosticsEngine;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The result of checking one syntax tree.
 *
 * @param errors The semantic diagnostics in reporting order.
 * @param variables The final variable table, sorted by name.
 * @param typeMismatches The subset of {@code errors} that are comparison mismatches.
 * @param success True if no semantic diagnostics were reported.
 */
public record SemanticReport(
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("variables") Map<String, Variable> variables,
        @JsonProperty("type_mismatches") List<String> typeMismatches,
        @JsonProperty("success") boolean success
) {

    /**
     * Builds the report from the state left behind by a semantic pass.
     * @param diagnostics The semantic diagnostics.
     * @param variables The variable table.
     * @return The semantic report.
     */
    public static SemanticReport of(DiagnosticsEngine diagnostics, VariableTable variables) {
        List<String> errors = List.copyOf(diagnostics.messages());
        List<String> mismatches = errors.stream()
                .filter(message -> message.contains("compare") || message.contains("comparison"))
                .collect(Collectors.toUnmodifiableList());
        return new SemanticReport(errors, variables.snapshot(), mismatches, errors.isEmpty());
    }
}
