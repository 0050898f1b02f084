package org.minipy.analyzer.frontend.semantics;

import org.minipy.analyzer.frontend.parser.ast.AstNode;
import org.minipy.analyzer.frontend.parser.ast.BinaryOpNode;
import org.minipy.analyzer.frontend.parser.ast.FunctionCallNode;
import org.minipy.analyzer.frontend.parser.ast.IdentifierNode;
import org.minipy.analyzer.frontend.parser.ast.MethodCallNode;
import org.minipy.analyzer.frontend.parser.ast.NumberLiteralNode;
import org.minipy.analyzer.frontend.parser.ast.StringLiteralNode;

import java.util.Set;

/**
 * Infers the static type of an expression from its shape and the current variable table.
 */
public class TypeInferrer {

    /** Operators whose result is always a boolean. */
    public static final Set<String> COMPARISON_OPERATORS = Set.of(">", "<", ">=", "<=", "==", "!=");

    private final VariableTable variables;

    /**
     * Creates an inferrer that resolves identifiers against the given table.
     * @param variables The variable table.
     */
    public TypeInferrer(VariableTable variables) {
        this.variables = variables;
    }

    /**
     * Infers the type of an expression.
     * @param node The expression, may be null.
     * @return The inferred type; {@link VariableType#UNKNOWN} when nothing can be said.
     */
    public VariableType infer(AstNode node) {
        if (node instanceof NumberLiteralNode) {
            return VariableType.INT;
        }
        if (node instanceof StringLiteralNode) {
            return VariableType.STRING;
        }
        if (node instanceof IdentifierNode identifier) {
            return variables.resolve(identifier.name())
                    .map(Variable::type)
                    .orElse(VariableType.UNKNOWN);
        }
        if (node instanceof BinaryOpNode binaryOp) {
            return inferBinaryOp(binaryOp);
        }
        if (node instanceof MethodCallNode methodCall) {
            return methodCall.value().contains(".lower") ? VariableType.STRING : VariableType.UNKNOWN;
        }
        if (node instanceof FunctionCallNode) {
            // print yields nothing usable in an expression.
            return VariableType.UNKNOWN;
        }
        return VariableType.UNKNOWN;
    }

    private VariableType inferBinaryOp(BinaryOpNode node) {
        if (COMPARISON_OPERATORS.contains(node.operator())) {
            return VariableType.BOOL;
        }
        if (node.left() == null || node.right() == null) {
            return VariableType.UNKNOWN;
        }
        VariableType left = infer(node.left());
        VariableType right = infer(node.right());
        if (left == VariableType.INT && right == VariableType.INT) {
            return VariableType.INT;
        }
        if (left == VariableType.STRING || right == VariableType.STRING) {
            return VariableType.STRING;
        }
        return VariableType.UNKNOWN;
    }
}
