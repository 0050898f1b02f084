package org.minipy.analyzer.frontend.lexer;

/**
 * Aggregate token counts per category.
 *
 * @param keywords Number of reserved words.
 * @param identifiers Number of identifiers.
 * @param numbers Number of numeric literals.
 * @param strings Number of string literals.
 * @param symbols Number of symbols.
 * @param errors Number of error tokens, unterminated strings included.
 */
public record TokenStatistics(
        int keywords,
        int identifiers,
        int numbers,
        int strings,
        int symbols,
        int errors
) {
}
