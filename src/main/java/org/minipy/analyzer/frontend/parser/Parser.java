package org.minipy.analyzer.frontend.parser;

import org.minipy.analyzer.diagnostics.DiagnosticsEngine;
import org.minipy.analyzer.frontend.lexer.Token;
import org.minipy.analyzer.frontend.lexer.TokenType;
import org.minipy.analyzer.frontend.parser.ast.AssignmentNode;
import org.minipy.analyzer.frontend.parser.ast.AstNode;
import org.minipy.analyzer.frontend.parser.ast.BinaryOpNode;
import org.minipy.analyzer.frontend.parser.ast.BlockNode;
import org.minipy.analyzer.frontend.parser.ast.ExpressionStatementNode;
import org.minipy.analyzer.frontend.parser.ast.FunctionCallNode;
import org.minipy.analyzer.frontend.parser.ast.FunctionDefNode;
import org.minipy.analyzer.frontend.parser.ast.IdentifierNode;
import org.minipy.analyzer.frontend.parser.ast.IfStatementNode;
import org.minipy.analyzer.frontend.parser.ast.MethodCallNode;
import org.minipy.analyzer.frontend.parser.ast.NumberLiteralNode;
import org.minipy.analyzer.frontend.parser.ast.ParameterNode;
import org.minipy.analyzer.frontend.parser.ast.ProgramNode;
import org.minipy.analyzer.frontend.parser.ast.StringLiteralNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * The recursive-descent parser. It consumes the tokens produced by the
 * {@link org.minipy.analyzer.frontend.lexer.Lexer} and builds a syntax tree rooted at a
 * {@link ProgramNode}.
 * <p>
 * Grammar:
 * <pre>
 * program       := statement*
 * statement     := functionDef | ifStatement | printStatement
 *                | IDENT '=' expression | expression
 * functionDef   := 'def' IDENT '(' (IDENT (',' IDENT)*)? ')' ':' block
 * ifStatement   := 'if' expression ':' block
 * printStatement:= 'print' '(' args? ')'
 * block         := statement*   (ends when the current or next token is 'def' or 'if')
 * expression    := term (('&gt;'|'&lt;'|'&gt;='|'&lt;='|'=='|'!=') term)*
 * term          := factor (('+'|'-') factor)*
 * factor        := '(' expression ')' | NUMBER | STRING
 *                | IDENT ( '(' args? ')' | '.' IDENT '(' args? ')' )?
 * args          := expression (',' expression)*
 * </pre>
 * There is no multiplicative level: {@code *} and {@code /} are scanned as symbols but never
 * become operators. Blocks are delimited by keyword lookahead, not by indentation.
 * <p>
 * A production that hits an unexpected token reports a diagnostic and yields null; the
 * statement loop then skips exactly one token and tries again. Parsing always completes.
 * Nesting deeper than the configured ceiling is reported instead of exhausting the stack.
 */
public class Parser {

    private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);

    private static final String[] COMPARISON_OPERATORS = {">", "<", ">=", "<=", "==", "!="};
    private static final String[] ADDITIVE_OPERATORS = {"+", "-"};

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final int maxDepth;
    private int current = 0;
    private int depth = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse. Whitespace, newline and error tokens are dropped.
     * @param diagnostics The engine for reporting syntax errors.
     * @param maxDepth The maximum nesting depth accepted before parsing is abandoned.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, int maxDepth) {
        this.tokens = tokens.stream()
                .filter(token -> token.type().isSignificant())
                .toList();
        this.diagnostics = diagnostics;
        this.maxDepth = maxDepth;
    }

    /**
     * Parses the entire token stream.
     * @return The root of the syntax tree, containing every statement that could be parsed.
     */
    public ProgramNode parse() {
        List<AstNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            AstNode statement;
            try {
                statement = statement();
            } catch (NestingTooDeepException e) {
                diagnostics.reportError(depthMessage(), e.line);
                depth = 0;
                skipLine(e.line);
                continue;
            }
            if (statement == null) {
                // Resynchronize by skipping one token.
                advance();
            } else if (height(statement) > maxDepth) {
                diagnostics.reportError(depthMessage(), statement.line());
            } else {
                statements.add(statement);
            }
        }
        LOGGER.debug("Parsed {} top-level statements from {} tokens ({} syntax errors)",
                statements.size(), tokens.size(), diagnostics.getDiagnostics().size());
        return new ProgramNode(statements);
    }

    private AstNode statement() {
        enter();
        try {
            if (matchKeyword("def")) {
                return functionDef();
            }
            if (matchKeyword("if")) {
                return ifStatement();
            }
            if (checkKeyword("print")) {
                return printStatement();
            }
            if (check(TokenType.IDENTIFIER) && checkNextSymbol("=")) {
                return assignment();
            }
            return expressionStatement();
        } finally {
            exit();
        }
    }

    private AstNode functionDef() {
        Token defToken = previous();

        if (!check(TokenType.IDENTIFIER)) {
            error("expected function name");
            return null;
        }
        String name = advance().text();

        if (!matchSymbol("(")) {
            error("expected '(' after function name");
            return null;
        }

        List<ParameterNode> parameters = new ArrayList<>();
        if (!checkSymbol(")")) {
            do {
                if (!check(TokenType.IDENTIFIER)) {
                    error("expected parameter name");
                    break;
                }
                Token parameter = advance();
                parameters.add(new ParameterNode(parameter.text(), parameter.line()));
            } while (matchSymbol(","));
        }

        if (!matchSymbol(")")) {
            error("expected ')' after parameters");
            return null;
        }
        if (!matchSymbol(":")) {
            error("expected ':' after function definition");
            return null;
        }

        BlockNode body = block();
        return new FunctionDefNode(name, parameters, body, defToken.line());
    }

    private AstNode ifStatement() {
        Token ifToken = previous();

        AstNode condition = expression();
        if (condition == null) {
            return null;
        }
        if (!matchSymbol(":")) {
            error("expected ':' after if condition");
            return null;
        }

        BlockNode body = block();
        return new IfStatementNode(condition, body, ifToken.line());
    }

    private AstNode printStatement() {
        Token printToken = advance();
        if (!matchSymbol("(")) {
            error("expected '(' after 'print'");
            return null;
        }
        List<AstNode> arguments = arguments();
        if (!matchSymbol(")")) {
            error("expected ')' after arguments");
        }
        FunctionCallNode call = new FunctionCallNode(printToken.text(), arguments, printToken.line());
        return new ExpressionStatementNode(call, call.line());
    }

    private BlockNode block() {
        enter();
        try {
            int line = isAtEnd() ? previous().line() : peek().line();
            List<AstNode> statements = new ArrayList<>();

            while (!isAtEnd()
                    && !checkKeyword("def") && !checkKeyword("if")
                    && !checkNextKeyword("def") && !checkNextKeyword("if")) {
                AstNode statement = statement();
                if (statement != null) {
                    statements.add(statement);
                } else {
                    advance();
                }
                // The last remaining token is left to the enclosing level.
                if (current >= tokens.size() - 1) {
                    break;
                }
            }
            return new BlockNode(statements, line);
        } finally {
            exit();
        }
    }

    private AstNode assignment() {
        if (!check(TokenType.IDENTIFIER)) {
            error("expected identifier in assignment");
            return null;
        }
        Token target = advance();

        if (!matchSymbol("=")) {
            error("expected '=' in assignment");
            return null;
        }

        AstNode value = expression();
        if (value == null) {
            return null;
        }
        return new AssignmentNode(target.text(), value, target.line());
    }

    private AstNode expressionStatement() {
        AstNode expression = expression();
        if (expression == null) {
            return null;
        }
        return new ExpressionStatementNode(expression, expression.line());
    }

    private AstNode expression() {
        return comparison();
    }

    private AstNode comparison() {
        AstNode expression = term();
        if (expression == null) {
            return null;
        }
        int folds = 0;
        try {
            while (matchSymbol(COMPARISON_OPERATORS)) {
                enter();
                folds++;
                String operator = previous().text();
                AstNode right = term();
                expression = new BinaryOpNode(operator, expression, right, expression.line());
            }
            return expression;
        } finally {
            depth -= folds;
        }
    }

    private AstNode term() {
        AstNode expression = factor();
        if (expression == null) {
            return null;
        }
        int folds = 0;
        try {
            while (matchSymbol(ADDITIVE_OPERATORS)) {
                enter();
                folds++;
                String operator = previous().text();
                AstNode right = factor();
                expression = new BinaryOpNode(operator, expression, right, expression.line());
            }
            return expression;
        } finally {
            depth -= folds;
        }
    }

    private AstNode factor() {
        if (matchSymbol("(")) {
            enter();
            try {
                AstNode expression = expression();
                if (!matchSymbol(")")) {
                    error("expected ')' after expression");
                }
                return expression;
            } finally {
                exit();
            }
        }

        if (check(TokenType.NUMBER)) {
            Token number = advance();
            return new NumberLiteralNode(number.text(), number.line());
        }

        if (check(TokenType.STRING)) {
            Token string = advance();
            return new StringLiteralNode(string.text(), string.line());
        }

        if (check(TokenType.IDENTIFIER)) {
            Token name = advance();

            if (matchSymbol("(")) {
                enter();
                try {
                    List<AstNode> arguments = arguments();
                    if (!matchSymbol(")")) {
                        error("expected ')' after arguments");
                    }
                    return new FunctionCallNode(name.text(), arguments, name.line());
                } finally {
                    exit();
                }
            }

            if (matchSymbol(".")) {
                if (!check(TokenType.IDENTIFIER)) {
                    error("expected method name after '.'");
                    return null;
                }
                Token method = advance();

                if (matchSymbol("(")) {
                    enter();
                    try {
                        List<AstNode> arguments = arguments();
                        if (!matchSymbol(")")) {
                            error("expected ')' after method arguments");
                        }
                        return new MethodCallNode(name.text(), method.text(), arguments, name.line());
                    } finally {
                        exit();
                    }
                }
                // Attribute access without a call is read as the object itself.
            }

            return new IdentifierNode(name.text(), name.line());
        }

        error("expected expression");
        return null;
    }

    private List<AstNode> arguments() {
        List<AstNode> arguments = new ArrayList<>();
        if (!checkSymbol(")")) {
            do {
                AstNode argument = expression();
                if (argument != null) {
                    arguments.add(argument);
                }
            } while (matchSymbol(","));
        }
        return arguments;
    }

    private int height(AstNode root) {
        int max = 0;
        Deque<Map.Entry<AstNode, Integer>> pending = new ArrayDeque<>();
        pending.push(Map.entry(root, 1));
        while (!pending.isEmpty()) {
            Map.Entry<AstNode, Integer> entry = pending.pop();
            max = Math.max(max, entry.getValue());
            for (AstNode child : entry.getKey().getChildren()) {
                pending.push(Map.entry(child, entry.getValue() + 1));
            }
        }
        return max;
    }

    private void enter() {
        if (++depth > maxDepth) {
            throw new NestingTooDeepException(currentLine());
        }
    }

    private void exit() {
        depth--;
    }

    private void skipLine(int line) {
        while (!isAtEnd() && peek().line() <= line) {
            advance();
        }
    }

    private String depthMessage() {
        return "maximum nesting depth of " + maxDepth + " exceeded";
    }

    private void error(String message) {
        diagnostics.reportError(message, currentLine());
    }

    private int currentLine() {
        // Past the last token there is no position; such errors are attributed to line 1.
        return isAtEnd() ? 1 : peek().line();
    }

    private boolean matchKeyword(String keyword) {
        if (checkKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchSymbol(String... symbols) {
        for (String symbol : symbols) {
            if (checkSymbol(symbol)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkKeyword(String keyword) {
        if (isAtEnd()) return false;
        return peek().isKeyword(keyword);
    }

    private boolean checkSymbol(String symbol) {
        if (isAtEnd()) return false;
        return peek().isSymbol(symbol);
    }

    private boolean checkNextKeyword(String keyword) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).isKeyword(keyword);
    }

    private boolean checkNextSymbol(String symbol) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).isSymbol(symbol);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    /**
     * Thrown when the recursion of the parser exceeds the configured ceiling. Caught by
     * {@link #parse()}, which reports it and resumes at the next source line.
     */
    private static final class NestingTooDeepException extends RuntimeException {
        private final int line;

        NestingTooDeepException(int line) {
            super(null, null, false, false);
            this.line = line;
        }
    }
}
