package org.minipy.analyzer.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one analysis stage.
 * <p>
 * This decouples error reporting from the scanner, parser and checker logic: the stages
 * never throw for malformed input, they report here and keep going.
 */
public class DiagnosticsEngine {

    private final Diagnostic.Stage stage;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Creates an engine for the given stage.
     *
     * @param stage The stage whose diagnostics this engine collects.
     */
    public DiagnosticsEngine(Diagnostic.Stage stage) {
        this.stage = stage;
    }

    /**
     * Reports an error without column information.
     *
     * @param message    The error message.
     * @param lineNumber The line number of the error.
     */
    public void reportError(String message, int lineNumber) {
        reportError(message, lineNumber, 0);
    }

    /**
     * Reports an error at an exact position.
     *
     * @param message    The error message.
     * @param lineNumber The line number of the error.
     * @param column     The column of the error.
     */
    public void reportError(String message, int lineNumber, int column) {
        diagnostics.add(new Diagnostic(stage, message, lineNumber, column));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns the rendered text of every diagnostic in reporting order.
     *
     * @return A new list of diagnostic messages.
     */
    public List<String> messages() {
        return diagnostics.stream()
                .map(Diagnostic::render)
                .collect(Collectors.toList());
    }
}
