package org.minipy.analyzer.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * <p>
 * Each type knows the key of the lexical category table it is filed under, if any.
 */
public enum TokenType {
    /** A reserved word such as {@code def} or {@code print}. */
    KEYWORD("PR"),
    /** A name that is not a reserved word. */
    IDENTIFIER("ID"),
    /** A numeric literal, possibly with one decimal point. */
    NUMBER("Numeros"),
    /** A quoted string literal, quotes included. Not filed in the category table. */
    STRING(null),
    /** An operator or punctuation symbol. */
    SYMBOL("Simbolos"),
    /** Whitespace. The scanner skips it; the parser filters it if present. */
    WHITESPACE(null),
    /** A line break. The scanner skips it; the parser filters it if present. */
    NEWLINE(null),
    /** An unrecognized character or an unterminated string. */
    ERROR("Error");

    private final String tableKey;

    TokenType(String tableKey) {
        this.tableKey = tableKey;
    }

    /**
     * Gets the category table key for this type.
     * @return The key, or null if tokens of this type are not filed in the table.
     */
    public String tableKey() {
        return tableKey;
    }

    /**
     * Checks whether the parser should see tokens of this type. Error tokens are left out
     * because the scanner has already accounted for them.
     * @return false for layout and error tokens.
     */
    public boolean isSignificant() {
        return this != WHITESPACE && this != NEWLINE && this != ERROR;
    }
}
