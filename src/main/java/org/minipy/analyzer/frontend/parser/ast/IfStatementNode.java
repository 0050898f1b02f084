package org.minipy.analyzer.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An {@code if} statement. There is no {@code elif} or {@code else}.
 *
 * @param condition The condition expression, or null if it is missing.
 * @param body The block executed when the condition holds.
 * @param line The line of the {@code if} keyword.
 */
public record IfStatementNode(AstNode condition, BlockNode body, int line) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.IF_STATEMENT;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(2);
        if (condition != null) {
            children.add(condition);
        }
        if (body != null) {
            children.add(body);
        }
        return children;
    }
}
