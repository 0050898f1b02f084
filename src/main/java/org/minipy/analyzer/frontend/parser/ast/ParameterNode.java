package org.minipy.analyzer.frontend.parser.ast;

/**
 * A parameter of a function definition.
 *
 * @param name The parameter name.
 * @param line The line of the parameter name.
 */
public record ParameterNode(String name, int line) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.PARAMETER;
    }

    @Override
    public String value() {
        return name;
    }
}
