package org.minipy.analyzer.frontend.parser.ast;

import java.util.List;

/**
 * A method call on a named object, e.g. {@code name.lower()}.
 *
 * @param target The object the method is called on.
 * @param method The method name.
 * @param arguments The call arguments.
 * @param line The line of the object name.
 */
public record MethodCallNode(String target, String method, List<AstNode> arguments, int line) implements AstNode {

    public MethodCallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.METHOD_CALL;
    }

    /**
     * Gets the dotted name of the call.
     * @return {@code target.method}
     */
    @Override
    public String value() {
        return target + "." + method;
    }

    @Override
    public List<AstNode> getChildren() {
        return arguments;
    }
}
