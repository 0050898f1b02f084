package org.minipy.analyzer.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the syntax tree.
 * <p>
 * The set of node types is closed. Every node exclusively owns its children; there are
 * no parent references and no shared subtrees.
 */
public sealed interface AstNode permits
        ProgramNode, FunctionDefNode, IfStatementNode, BlockNode, AssignmentNode,
        ExpressionStatementNode, BinaryOpNode, FunctionCallNode, MethodCallNode,
        IdentifierNode, NumberLiteralNode, StringLiteralNode, ParameterNode {

    /**
     * Gets the kind of this node.
     * @return The node kind.
     */
    NodeKind kind();

    /**
     * Gets the line of the leftmost token that contributed to this node.
     * @return The 1-based line number.
     */
    int line();

    /**
     * Gets the textual payload of this node: an operator, a name or a literal.
     * @return The payload, or null if the node kind has none.
     */
    default String value() {
        return null;
    }

    /**
     * Returns a list of the direct child nodes, in source order.
     * This allows generic traversals without knowing the structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
