package org.minipy.analyzer.frontend.parser.ast;

import java.util.List;

/**
 * The body of a function definition or an {@code if} statement.
 *
 * @param statements The statements of the block.
 * @param line The line of the first token of the block.
 */
public record BlockNode(List<AstNode> statements, int line) implements AstNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BLOCK;
    }

    @Override
    public List<AstNode> getChildren() {
        return statements;
    }
}
