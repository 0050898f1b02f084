package org.minipy.analyzer.frontend.semantics.analysis;

import org.minipy.analyzer.frontend.parser.ast.AstNode;
import org.minipy.analyzer.frontend.parser.ast.IfStatementNode;

/**
 * Handles {@link IfStatementNode}s. The condition is checked like any other expression,
 * then the body is analyzed.
 */
public class IfStatementAnalysisHandler implements IAnalysisHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        if (!(node instanceof IfStatementNode ifStatement)) {
            return;
        }

        if (ifStatement.condition() == null) {
            context.reportError("if statement without condition", ifStatement.line());
            return;
        }

        context.analyze(ifStatement.condition());
        context.analyze(ifStatement.body());
    }
}
