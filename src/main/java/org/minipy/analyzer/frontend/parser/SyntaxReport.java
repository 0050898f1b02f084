package org.minipy.analyzer.frontend.parser;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.minipy.analyzer.diagnostics.Diagnostic;
import org.minipy.analyzer.diagnostics.DiagnosticsEngine;
import org.minipy.analyzer.frontend.parser.ast.AstNodeJsonSerializer;
import org.minipy.analyzer.frontend.parser.ast.ProgramNode;

import java.util.List;

/**
 * The result of parsing one token sequence.
 *
 * @param ast The (possibly partial) syntax tree.
 * @param errors The syntax diagnostics in reporting order.
 * @param success True if no syntax diagnostics were reported.
 * @param errorLine The line of the first syntax diagnostic, or 0 if there is none.
 */
public record SyntaxReport(
        @JsonProperty("ast") @JsonSerialize(using = AstNodeJsonSerializer.class) ProgramNode ast,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("success") boolean success,
        @JsonProperty("error_line") int errorLine
) {

    /**
     * Builds the report from a parsed tree and the diagnostics collected while parsing it.
     * @param ast The syntax tree.
     * @param diagnostics The syntax diagnostics.
     * @return The syntax report.
     */
    public static SyntaxReport of(ProgramNode ast, DiagnosticsEngine diagnostics) {
        List<Diagnostic> reported = diagnostics.getDiagnostics();
        int errorLine = reported.isEmpty() ? 0 : reported.get(0).lineNumber();
        return new SyntaxReport(ast, List.copyOf(diagnostics.messages()), reported.isEmpty(), errorLine);
    }
}
