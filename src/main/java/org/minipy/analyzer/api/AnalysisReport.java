package org.minipy.analyzer.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.minipy.analyzer.frontend.lexer.LexicalReport;
import org.minipy.analyzer.frontend.parser.SyntaxReport;
import org.minipy.analyzer.frontend.semantics.SemanticReport;

/**
 * The combined result of one analysis run.
 *
 * @param lexical The scanner report.
 * @param syntax The parser report.
 * @param semantic The semantic checker report.
 * @param success True if neither the parser nor the checker reported an error. Lexical
 *                errors do not count.
 * @param error A summary of the failing stage, or null when successful.
 */
public record AnalysisReport(
        @JsonProperty("lexical_analysis") LexicalReport lexical,
        @JsonProperty("syntax_analysis") SyntaxReport syntax,
        @JsonProperty("semantic_analysis") SemanticReport semantic,
        @JsonProperty("success") boolean success,
        @JsonProperty("error") @JsonInclude(JsonInclude.Include.NON_NULL) String error
) {

    /**
     * Combines the stage reports and derives the overall outcome.
     * @param lexical The scanner report.
     * @param syntax The parser report.
     * @param semantic The semantic checker report.
     * @return The combined report.
     */
    public static AnalysisReport of(LexicalReport lexical, SyntaxReport syntax, SemanticReport semantic) {
        String error = null;
        if (!syntax.success()) {
            error = "syntax errors: " + String.join("; ", syntax.errors());
        } else if (!semantic.success()) {
            error = "semantic errors: " + String.join("; ", semantic.errors());
        }
        return new AnalysisReport(lexical, syntax, semantic, error == null, error);
    }
}
