package org.minipy.analyzer.frontend.lexer;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Keyword, Identifier, Number).
 * @param text The exact text of the token from the source code.
 * @param line The 1-based line number where the token was found.
 * @param column The 1-based column where the token begins.
 */
public record Token(
        @JsonProperty("type") TokenType type,
        @JsonProperty("value") String text,
        @JsonProperty("line") int line,
        @JsonProperty("column") int column
) {

    /**
     * Checks whether this token is the given keyword.
     * @param keyword The reserved word to compare against.
     * @return true if this is a KEYWORD token with exactly that text.
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    /**
     * Checks whether this token is the given symbol.
     * @param symbol The symbol text to compare against.
     * @return true if this is a SYMBOL token with exactly that text.
     */
    public boolean isSymbol(String symbol) {
        return type == TokenType.SYMBOL && text.equals(symbol);
    }
}
