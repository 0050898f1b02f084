package org.minipy.analyzer.frontend.semantics.analysis;

import org.minipy.analyzer.frontend.parser.ast.AssignmentNode;
import org.minipy.analyzer.frontend.parser.ast.AstNode;
import org.minipy.analyzer.frontend.semantics.Variable;

/**
 * Handles {@link AssignmentNode}s: infers the type of the value and records the target
 * in the variable table, replacing any earlier entry.
 */
public class AssignmentAnalysisHandler implements IAnalysisHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        if (!(node instanceof AssignmentNode assignment)) {
            return;
        }

        if (assignment.expression() == null) {
            context.reportError("assignment without value", assignment.line());
            return;
        }

        // The type is inferred before the target is defined, so `x = x + 1` sees the old x.
        context.variables().define(new Variable(
                assignment.target(),
                context.typeOf(assignment.expression()),
                assignment.line()));

        context.analyze(assignment.expression());
    }
}
