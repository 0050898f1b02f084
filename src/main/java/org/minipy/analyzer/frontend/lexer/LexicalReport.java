package org.minipy.analyzer.frontend.lexer;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * The result of scanning one source text.
 *
 * @param tokens All tokens in source order.
 * @param table Raw lexemes grouped under the category keys {@code PR}, {@code ID},
 *              {@code Numeros}, {@code Simbolos} and {@code Error}. String literals are not filed.
 * @param statistics Aggregate counts per category.
 * @param errors Messages for unrecognized characters.
 * @param reservedWords The number of reserved words, equal to {@code statistics.keywords()}.
 */
public record LexicalReport(
        @JsonProperty("tokens") List<Token> tokens,
        @JsonProperty("table") Map<String, List<String>> table,
        @JsonProperty("statistics") TokenStatistics statistics,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("reserved_words") int reservedWords
) {
}
