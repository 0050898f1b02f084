package org.minipy.analyzer.frontend.parser.ast;

import java.util.List;

/**
 * An expression used as a statement, e.g. a call.
 *
 * @param expression The wrapped expression.
 * @param line The line of the expression.
 */
public record ExpressionStatementNode(AstNode expression, int line) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.EXPRESSION_STATEMENT;
    }

    @Override
    public List<AstNode> getChildren() {
        return expression == null ? List.of() : List.of(expression);
    }
}
