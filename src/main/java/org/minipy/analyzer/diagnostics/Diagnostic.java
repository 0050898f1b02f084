package org.minipy.analyzer.diagnostics;

/**
 * Represents a single diagnostic produced by one of the analysis stages.
 *
 * @param stage The stage that reported the diagnostic.
 * @param message The condition being reported, without position information.
 * @param lineNumber The 1-based line the diagnostic refers to.
 * @param column The 1-based column, or 0 if the stage does not track columns.
 */
public record Diagnostic(
        Stage stage,
        String message,
        int lineNumber,
        int column
) {
    /**
     * The analysis stage a diagnostic originates from. Each stage renders its
     * diagnostics with its own fixed message template.
     */
    public enum Stage {
        /** Diagnostics of the scanner, e.g. unrecognized characters. */
        LEXICAL,
        /** Grammar violations found by the parser. */
        SYNTAX,
        /** Type, operator and method violations found by the semantic checker. */
        SEMANTIC
    }

    /**
     * Renders the diagnostic with the template of its stage, e.g.
     * {@code semantic error at line 3: incomplete binary operation}.
     *
     * @return The user-facing diagnostic text.
     */
    public String render() {
        return switch (stage) {
            case LEXICAL -> String.format("%s at line %d, column %d", message, lineNumber, column);
            case SYNTAX -> String.format("error at line %d: %s", lineNumber, message);
            case SEMANTIC -> String.format("semantic error at line %d: %s", lineNumber, message);
        };
    }
}
