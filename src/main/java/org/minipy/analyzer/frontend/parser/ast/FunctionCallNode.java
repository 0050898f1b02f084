package org.minipy.analyzer.frontend.parser.ast;

import java.util.List;

/**
 * A call of a plain function, e.g. {@code print(x)}.
 *
 * @param name The called function.
 * @param arguments The call arguments.
 * @param line The line of the function name.
 */
public record FunctionCallNode(String name, List<AstNode> arguments, int line) implements AstNode {

    public FunctionCallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_CALL;
    }

    @Override
    public String value() {
        return name;
    }

    @Override
    public List<AstNode> getChildren() {
        return arguments;
    }
}
