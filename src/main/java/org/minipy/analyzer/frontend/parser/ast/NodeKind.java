package org.minipy.analyzer.frontend.parser.ast;

/**
 * The kinds of syntax tree nodes, with the name each kind carries in serialized trees.
 */
public enum NodeKind {
    PROGRAM("Program"),
    FUNCTION_DEF("FunctionDef"),
    IF_STATEMENT("IfStatement"),
    BLOCK("Block"),
    ASSIGNMENT("Assignment"),
    EXPRESSION_STATEMENT("ExpressionStatement"),
    BINARY_OP("BinaryOp"),
    FUNCTION_CALL("FunctionCall"),
    METHOD_CALL("MethodCall"),
    IDENTIFIER("Identifier"),
    NUMBER("Number"),
    STRING("String"),
    PARAMETER("Parameter");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Gets the name used for this kind in serialized trees.
     * @return The display name, e.g. {@code BinaryOp}.
     */
    public String displayName() {
        return displayName;
    }
}
