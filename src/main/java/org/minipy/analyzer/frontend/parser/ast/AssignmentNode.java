package org.minipy.analyzer.frontend.parser.ast;

import java.util.List;

/**
 * An assignment {@code target = expression}.
 *
 * @param target The assigned variable name.
 * @param expression The assigned value, or null if it is missing.
 * @param line The line of the target name.
 */
public record AssignmentNode(String target, AstNode expression, int line) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGNMENT;
    }

    @Override
    public String value() {
        return target;
    }

    @Override
    public List<AstNode> getChildren() {
        return expression == null ? List.of() : List.of(expression);
    }
}
