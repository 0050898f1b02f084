package org.minipy.analyzer.frontend.parser.ast;

import java.util.List;

/**
 * The root of every syntax tree.
 *
 * @param statements The top-level statements in source order.
 */
public record ProgramNode(List<AstNode> statements) implements AstNode {

    public ProgramNode {
        statements = List.copyOf(statements);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROGRAM;
    }

    @Override
    public int line() {
        return 1;
    }

    @Override
    public List<AstNode> getChildren() {
        return statements;
    }
}
