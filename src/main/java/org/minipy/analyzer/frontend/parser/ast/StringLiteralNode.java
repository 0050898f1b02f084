package org.minipy.analyzer.frontend.parser.ast;

/**
 * A string literal. The text includes the surrounding quotes.
 *
 * @param text The literal text.
 * @param line The line of the literal.
 */
public record StringLiteralNode(String text, int line) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.STRING;
    }

    @Override
    public String value() {
        return text;
    }
}
