package org.minipy.analyzer.frontend.semantics.analysis;

import org.minipy.analyzer.frontend.parser.ast.AstNode;
import org.minipy.analyzer.frontend.parser.ast.MethodCallNode;
import org.minipy.analyzer.frontend.semantics.Variable;
import org.minipy.analyzer.frontend.semantics.VariableType;

import java.util.Optional;

/**
 * Handles {@link org.minipy.analyzer.frontend.parser.ast.FunctionCallNode}s and
 * {@link MethodCallNode}s.
 * <p>
 * For a method call the receiver must be a known variable, and {@code lower()} is only
 * available on strings. Other methods and plain function calls are not validated. The
 * arguments of every call are analyzed.
 */
public class CallAnalysisHandler implements IAnalysisHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        if (node instanceof MethodCallNode methodCall) {
            checkReceiver(methodCall, context);
        }
        for (AstNode argument : node.getChildren()) {
            context.analyze(argument);
        }
    }

    private void checkReceiver(MethodCallNode methodCall, AnalysisContext context) {
        Optional<Variable> receiver = context.variables().resolve(methodCall.target());
        if (receiver.isEmpty()) {
            context.reportError(
                    String.format("variable '%s' is not defined", methodCall.target()),
                    methodCall.line());
            return;
        }
        if (methodCall.method().equals("lower") && receiver.get().type() != VariableType.STRING) {
            context.reportError(
                    String.format("method 'lower()' is not available for the type of '%s'", methodCall.target()),
                    methodCall.line());
        }
    }
}
