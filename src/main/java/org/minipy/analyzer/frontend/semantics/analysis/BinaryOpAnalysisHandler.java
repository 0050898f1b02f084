package org.minipy.analyzer.frontend.semantics.analysis;

import org.minipy.analyzer.frontend.parser.ast.AstNode;
import org.minipy.analyzer.frontend.parser.ast.BinaryOpNode;
import org.minipy.analyzer.frontend.semantics.VariableType;

/**
 * Handles {@link BinaryOpNode}s by checking the operand types against the operator.
 * <p>
 * Relational and equality operators reject a mix of numbers and strings. Arithmetic
 * operators reject strings except for {@code +}, which concatenates. The parser never
 * produces {@code *} or {@code /} operations; they are checked all the same for trees built
 * by other means.
 */
public class BinaryOpAnalysisHandler implements IAnalysisHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        if (!(node instanceof BinaryOpNode binaryOp)) {
            return;
        }

        if (binaryOp.left() == null || binaryOp.right() == null) {
            context.reportError("incomplete binary operation", binaryOp.line());
            return;
        }

        String operator = binaryOp.operator();
        VariableType left = context.typeOf(binaryOp.left());
        VariableType right = context.typeOf(binaryOp.right());

        switch (operator) {
            case ">", "<", ">=", "<=" -> {
                if (left == VariableType.STRING && right == VariableType.INT) {
                    context.reportError("cannot compare string with number using '" + operator + "'", binaryOp.line());
                } else if (left == VariableType.INT && right == VariableType.STRING) {
                    context.reportError("cannot compare number with string using '" + operator + "'", binaryOp.line());
                }
            }
            case "==", "!=" -> {
                if (left == VariableType.STRING && right == VariableType.INT) {
                    context.reportError("comparison between incompatible types: string and number", binaryOp.line());
                } else if (left == VariableType.INT && right == VariableType.STRING) {
                    context.reportError("comparison between incompatible types: number and string", binaryOp.line());
                }
            }
            case "+", "-", "*", "/" -> {
                if ((left == VariableType.STRING || right == VariableType.STRING) && !operator.equals("+")) {
                    context.reportError("operator '" + operator + "' is not valid for strings", binaryOp.line());
                }
            }
            default -> {
                // other operators carry no type rule
            }
        }

        context.analyze(binaryOp.left());
        context.analyze(binaryOp.right());
    }
}
