package org.minipy.analyzer.frontend.semantics.analysis;

import org.minipy.analyzer.frontend.parser.ast.AstNode;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for analyzing a specific type of AST node, including the
 * decision whether and when to descend into its children.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single AST node.
     * @param node The node to analyze.
     * @param context The running analysis.
     */
    void analyze(AstNode node, AnalysisContext context);
}
