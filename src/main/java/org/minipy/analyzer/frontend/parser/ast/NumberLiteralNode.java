package org.minipy.analyzer.frontend.parser.ast;

/**
 * A numeric literal. The text is kept as written, e.g. {@code 3.14}.
 *
 * @param text The literal text.
 * @param line The line of the literal.
 */
public record NumberLiteralNode(String text, int line) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.NUMBER;
    }

    @Override
    public String value() {
        return text;
    }
}
