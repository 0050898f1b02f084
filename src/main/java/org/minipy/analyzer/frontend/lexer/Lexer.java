package org.minipy.analyzer.frontend.lexer;

import org.minipy.analyzer.diagnostics.Diagnostic;
import org.minipy.analyzer.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a source text into a sequence of classified tokens.
 * <p>
 * The source is processed line by line and the column counter restarts at 1 on every
 * line. At each position the first matching rule wins: whitespace, {@code #} comment,
 * quoted string, number, identifier or reserved word, and finally symbols, two-character
 * symbols before one-character ones. A character matching nothing becomes an
 * {@link TokenType#ERROR} token and is reported. Unterminated strings also become
 * error tokens but are not reported.
 * <p>
 * A Lexer instance scans exactly one source and is not thread-safe; the constant tables
 * are immutable and shared.
 */
public class Lexer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Lexer.class);

    /** The reserved words. Identifier-shaped lexemes found here are classified as keywords. */
    public static final Set<String> RESERVED_WORDS = Set.of(
            "def", "if", "else", "elif", "while",
            "for", "in", "try", "except", "finally",
            "with", "as", "pass", "break", "continue",
            "return", "yield", "import", "from", "class",
            "and", "or", "not", "is", "lambda",
            "None", "True", "False", "print"
    );

    /** The recognized symbols, two-character symbols first. */
    public static final List<String> SYMBOLS = List.of(
            "==", "!=", "<=", ">=", ">>", "<<", "**", "//", "+=", "-=", "*=", "/=",
            "=", "+", "-", "*", "/", "%", "<", ">", "(", ")", "[", "]", "{", "}",
            ":", ";", ",", ".", "&", "|", "^", "~", "!", "@", "#", "$", "?"
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final Map<String, List<String>> table = new LinkedHashMap<>();
    private int keywords;
    private int identifiers;
    private int numbers;
    private int strings;
    private int symbols;
    private int errors;

    /**
     * Creates a new Lexer with its own diagnostics engine.
     * @param source The source code as a single string. A null source is treated as empty.
     */
    public Lexer(String source) {
        this(source, new DiagnosticsEngine(Diagnostic.Stage.LEXICAL));
    }

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string. A null source is treated as empty.
     * @param diagnostics The engine for reporting unrecognized characters.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source == null ? "" : source;
        this.diagnostics = diagnostics;
        for (TokenType type : TokenType.values()) {
            if (type.tableKey() != null) {
                table.put(type.tableKey(), new ArrayList<>());
            }
        }
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens.
     */
    public List<Token> scanTokens() {
        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            scanLine(lines[i], i + 1);
        }
        LOGGER.debug("Scanned {} tokens from {} lines ({} unrecognized characters)",
                tokens.size(), lines.length, diagnostics.getDiagnostics().size());
        return tokens;
    }

    /**
     * Scans the source and bundles tokens, category table, statistics and diagnostics.
     * @return The lexical report.
     */
    public LexicalReport scan() {
        scanTokens();
        Map<String, List<String>> frozenTable = new LinkedHashMap<>();
        table.forEach((key, lexemes) -> frozenTable.put(key, List.copyOf(lexemes)));
        return new LexicalReport(
                List.copyOf(tokens),
                Collections.unmodifiableMap(frozenTable),
                new TokenStatistics(keywords, identifiers, numbers, strings, symbols, errors),
                List.copyOf(diagnostics.messages()),
                keywords
        );
    }

    private void scanLine(String line, int lineNumber) {
        int i = 0;
        int column = 1;
        while (i < line.length()) {
            char c = line.charAt(i);
            int length;

            if (isWhitespace(c)) {
                length = 1;
            } else if (c == '#') {
                // A comment goes until the end of the line.
                break;
            } else if (c == '"' || c == '\'') {
                length = string(line, i, lineNumber, column, c);
            } else if (isDigit(c)) {
                length = number(line, i, lineNumber, column);
            } else if (isAlpha(c)) {
                length = identifier(line, i, lineNumber, column);
            } else {
                length = symbol(line, i, lineNumber, column);
            }

            column += line.codePointCount(i, i + length);
            i += length;
        }
    }

    private int string(String line, int start, int lineNumber, int column, char quote) {
        int i = start + 1;
        while (i < line.length() && line.charAt(i) != quote) {
            if (line.charAt(i) == '\\' && i + 1 < line.length()) {
                i += 2;
            } else {
                i++;
            }
        }

        if (i >= line.length()) {
            // Unterminated: the rest of the line becomes one error token, without a diagnostic.
            addToken(TokenType.ERROR, line.substring(start), lineNumber, column);
            return line.length() - start;
        }

        addToken(TokenType.STRING, line.substring(start, i + 1), lineNumber, column);
        return i + 1 - start;
    }

    private int number(String line, int start, int lineNumber, int column) {
        int i = start;
        boolean hasDecimal = false;
        while (i < line.length() && (isDigit(line.charAt(i)) || line.charAt(i) == '.')) {
            if (line.charAt(i) == '.') {
                if (hasDecimal) {
                    break;
                }
                hasDecimal = true;
            }
            i++;
        }
        addToken(TokenType.NUMBER, line.substring(start, i), lineNumber, column);
        return i - start;
    }

    private int identifier(String line, int start, int lineNumber, int column) {
        int i = start;
        while (i < line.length() && isAlphaNumeric(line.charAt(i))) {
            i++;
        }
        String text = line.substring(start, i);
        TokenType type = RESERVED_WORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        addToken(type, text, lineNumber, column);
        return i - start;
    }

    private int symbol(String line, int start, int lineNumber, int column) {
        if (start + 2 <= line.length()) {
            String twoChar = line.substring(start, start + 2);
            if (SYMBOLS.contains(twoChar)) {
                addToken(TokenType.SYMBOL, twoChar, lineNumber, column);
                return 2;
            }
        }

        String oneChar = line.substring(start, start + 1);
        if (SYMBOLS.contains(oneChar)) {
            addToken(TokenType.SYMBOL, oneChar, lineNumber, column);
            return 1;
        }

        // A surrogate pair is one character.
        int width = Character.charCount(line.codePointAt(start));
        String unknown = line.substring(start, start + width);
        diagnostics.reportError("unrecognized character '" + unknown + "'", lineNumber, column);
        addToken(TokenType.ERROR, unknown, lineNumber, column);
        return width;
    }

    private void addToken(TokenType type, String text, int lineNumber, int column) {
        tokens.add(new Token(type, text, lineNumber, column));
        if (type.tableKey() != null) {
            table.get(type.tableKey()).add(text);
        }
        switch (type) {
            case KEYWORD -> keywords++;
            case IDENTIFIER -> identifiers++;
            case NUMBER -> numbers++;
            case STRING -> strings++;
            case SYMBOL -> symbols++;
            case ERROR -> errors++;
            default -> {
                // layout tokens are not counted
            }
        }
    }

    private boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
