package org.minipy.analyzer.frontend.semantics.analysis;

import org.minipy.analyzer.frontend.parser.ast.AstNode;
import org.minipy.analyzer.frontend.semantics.VariableTable;
import org.minipy.analyzer.frontend.semantics.VariableType;

/**
 * The state a handler sees while the semantic pass is running.
 */
public interface AnalysisContext {

    /**
     * Gets the variable table of the program being analyzed.
     * @return The variable table.
     */
    VariableTable variables();

    /**
     * Infers the type of an expression against the current variable table.
     * @param node The expression.
     * @return The inferred type.
     */
    VariableType typeOf(AstNode node);

    /**
     * Reports a semantic error.
     * @param message The error reason.
     * @param line The line of the offending node.
     */
    void reportError(String message, int line);

    /**
     * Continues the pass into a sub-node. Null nodes are ignored.
     * @param node The node to analyze.
     */
    void analyze(AstNode node);
}
