package org.minipy.analyzer.frontend.parser.ast;

/**
 * A reference to a variable by name.
 *
 * @param name The referenced name.
 * @param line The line of the name.
 */
public record IdentifierNode(String name, int line) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.IDENTIFIER;
    }

    @Override
    public String value() {
        return name;
    }
}
