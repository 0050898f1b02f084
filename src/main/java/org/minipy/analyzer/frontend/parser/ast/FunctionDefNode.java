package org.minipy.analyzer.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A function definition: {@code def name(a, b): block}.
 *
 * @param name The function name.
 * @param parameters The declared parameters.
 * @param body The function body.
 * @param line The line of the {@code def} keyword.
 */
public record FunctionDefNode(
        String name,
        List<ParameterNode> parameters,
        BlockNode body,
        int line
) implements AstNode {

    public FunctionDefNode {
        parameters = List.copyOf(parameters);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_DEF;
    }

    @Override
    public String value() {
        return name;
    }

    @Override
    public List<AstNode> getChildren() {
        // Parameters first, then the body.
        List<AstNode> children = new ArrayList<>(parameters);
        children.add(body);
        return children;
    }
}
