package org.minipy.analyzer.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A binary operation such as {@code a + b} or {@code a >= b}.
 *
 * @param operator The operator symbol.
 * @param left The left operand.
 * @param right The right operand, or null if the parser could not read one.
 * @param line The line of the left operand.
 */
public record BinaryOpNode(String operator, AstNode left, AstNode right, int line) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_OP;
    }

    @Override
    public String value() {
        return operator;
    }

    @Override
    public List<AstNode> getChildren() {
        // Missing operands are left out, so an incomplete operation has fewer than two children.
        List<AstNode> children = new ArrayList<>(2);
        if (left != null) {
            children.add(left);
        }
        if (right != null) {
            children.add(right);
        }
        return children;
    }
}
