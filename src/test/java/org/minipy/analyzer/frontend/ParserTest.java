package org.minipy.analyzer.frontend;

import org.minipy.analyzer.diagnostics.Diagnostic;
import org.minipy.analyzer.diagnostics.DiagnosticsEngine;
import org.minipy.analyzer.frontend.lexer.Lexer;
import org.minipy.analyzer.frontend.parser.Parser;
import org.minipy.analyzer.frontend.parser.SyntaxReport;
import org.minipy.analyzer.frontend.parser.ast.AssignmentNode;
import org.minipy.analyzer.frontend.parser.ast.AstNode;
import org.minipy.analyzer.frontend.parser.ast.BinaryOpNode;
import org.minipy.analyzer.frontend.parser.ast.ExpressionStatementNode;
import org.minipy.analyzer.frontend.parser.ast.FunctionCallNode;
import org.minipy.analyzer.frontend.parser.ast.FunctionDefNode;
import org.minipy.analyzer.frontend.parser.ast.IdentifierNode;
import org.minipy.analyzer.frontend.parser.ast.IfStatementNode;
import org.minipy.analyzer.frontend.parser.ast.MethodCallNode;
import org.minipy.analyzer.frontend.parser.ast.NodeKind;
import org.minipy.analyzer.frontend.parser.ast.NumberLiteralNode;
import org.minipy.analyzer.frontend.parser.ast.ParameterNode;
import org.minipy.analyzer.frontend.parser.ast.ProgramNode;
import org.minipy.analyzer.frontend.parser.ast.StringLiteralNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Parser}.
 * These tests verify the grammar, the keyword-delimited blocks, the error recovery and the
 * nesting ceiling.
 */
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    private ProgramNode parse(String source) {
        return parse(source, 200);
    }

    private ProgramNode parse(String source, int maxDepth) {
        diagnostics = new DiagnosticsEngine(Diagnostic.Stage.SYNTAX);
        return new Parser(new Lexer(source).scanTokens(), diagnostics, maxDepth).parse();
    }

    /**
     * Verifies that an assignment of a number literal is parsed into an {@link AssignmentNode}.
     */
    @Test
    @Tag("unit")
    void testSimpleAssignment() {
        // Act
        ProgramNode program = parse("x = 5");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(program.statements()).hasSize(1);
        AssignmentNode assignment = (AssignmentNode) program.statements().get(0);
        assertThat(assignment.target()).isEqualTo("x");
        assertThat(assignment.line()).isEqualTo(1);
        assertThat(assignment.expression()).isInstanceOf(NumberLiteralNode.class);
        assertThat(assignment.expression().value()).isEqualTo("5");
    }

    /**
     * Verifies function definitions with parameters and a body.
     */
    @Test
    @Tag("unit")
    void testFunctionDefinition() {
        // Act
        ProgramNode program = parse("def add(a, b):\n  total = a + b");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        FunctionDefNode function = (FunctionDefNode) program.statements().get(0);
        assertThat(function.name()).isEqualTo("add");
        assertThat(function.parameters()).extracting(ParameterNode::name).containsExactly("a", "b");
        assertThat(function.body().statements()).hasSize(1);
        assertThat(function.body().line()).isEqualTo(2);

        AssignmentNode total = (AssignmentNode) function.body().statements().get(0);
        BinaryOpNode sum = (BinaryOpNode) total.expression();
        assertThat(sum.operator()).isEqualTo("+");
        assertThat(sum.getChildren()).extracting(AstNode::value).containsExactly("a", "b");
        assertThat(function.getChildren()).extracting(AstNode::kind)
                .containsExactly(NodeKind.PARAMETER, NodeKind.PARAMETER, NodeKind.BLOCK);
    }

    /**
     * Verifies that a block ends as soon as the current token is {@code def} or {@code if},
     * so the function after an if statement is a sibling, not part of the if body.
     */
    @Test
    @Tag("unit")
    void testBlockEndsAtKeywordLookahead() {
        // Act
        ProgramNode program = parse("if x > 1:\n  y = 1\ndef f():\n  pass");

        // Assert
        assertThat(program.statements()).extracting(AstNode::kind)
                .containsExactly(NodeKind.IF_STATEMENT, NodeKind.FUNCTION_DEF);

        IfStatementNode ifStatement = (IfStatementNode) program.statements().get(0);
        assertThat(ifStatement.condition()).isInstanceOf(BinaryOpNode.class);
        assertThat(ifStatement.body().statements()).hasSize(1);
        assertThat(((AssignmentNode) ifStatement.body().statements().get(0)).target()).isEqualTo("y");

        // 'pass' is a keyword that no statement rule accepts.
        FunctionDefNode function = (FunctionDefNode) program.statements().get(1);
        assertThat(function.body().statements()).isEmpty();
        assertThat(diagnostics.messages()).containsExactly("error at line 4: expected expression");
    }

    /**
     * Verifies that comparison binds looser than addition and both fold to the left.
     */
    @Test
    @Tag("unit")
    void testOperatorPrecedenceAndAssociativity() {
        // Act
        ProgramNode program = parse("r = a - b + c > d");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        BinaryOpNode comparison = (BinaryOpNode) ((AssignmentNode) program.statements().get(0)).expression();
        assertThat(comparison.operator()).isEqualTo(">");
        assertThat(comparison.right()).isInstanceOf(IdentifierNode.class);

        BinaryOpNode plus = (BinaryOpNode) comparison.left();
        assertThat(plus.operator()).isEqualTo("+");
        assertThat(plus.right().value()).isEqualTo("c");
        assertThat(((BinaryOpNode) plus.left()).operator()).isEqualTo("-");
    }

    /**
     * Verifies that {@code *} is not an operator: the expression statement ends before it.
     */
    @Test
    @Tag("unit")
    void testMultiplicationIsNotParsed() {
        // Act
        ProgramNode program = parse("y = 2 * 3");

        // Assert
        assertThat(program.statements().get(0)).isInstanceOf(AssignmentNode.class);
        assertThat(((AssignmentNode) program.statements().get(0)).expression()).isInstanceOf(NumberLiteralNode.class);
        assertThat(diagnostics.messages()).containsExactly("error at line 1: expected expression");
    }

    /**
     * Verifies that print statements become calls named print with their arguments.
     */
    @Test
    @Tag("unit")
    void testPrintStatement() {
        // Act
        ProgramNode program = parse("print(x, 'a')");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        ExpressionStatementNode statement = (ExpressionStatementNode) program.statements().get(0);
        FunctionCallNode call = (FunctionCallNode) statement.expression();
        assertThat(call.name()).isEqualTo("print");
        assertThat(call.arguments()).hasSize(2);
        assertThat(call.arguments().get(0)).isInstanceOf(IdentifierNode.class);
        assertThat(call.arguments().get(1)).isInstanceOf(StringLiteralNode.class);
        assertThat(call.arguments().get(1).value()).isEqualTo("'a'");
    }

    /**
     * Verifies that print without an opening parenthesis is a syntax error.
     */
    @Test
    @Tag("unit")
    void testPrintWithoutParenthesis() {
        // Act
        parse("print x");

        // Assert
        assertThat(diagnostics.messages()).containsExactly("error at line 1: expected '(' after 'print'");
    }

    /**
     * Verifies method calls and that an attribute access without a call reads as the object.
     */
    @Test
    @Tag("unit")
    void testMethodCallAndAttributeAccess() {
        // Act
        ProgramNode program = parse("t = s.lower()\nu = s.upper");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        MethodCallNode call = (MethodCallNode) ((AssignmentNode) program.statements().get(0)).expression();
        assertThat(call.target()).isEqualTo("s");
        assertThat(call.method()).isEqualTo("lower");
        assertThat(call.value()).isEqualTo("s.lower");

        AstNode attribute = ((AssignmentNode) program.statements().get(1)).expression();
        assertThat(attribute).isInstanceOf(IdentifierNode.class);
        assertThat(attribute.value()).isEqualTo("s");
    }

    /**
     * Verifies that every node carries the line of its leftmost token, also for calls whose
     * arguments continue on later lines.
     */
    @Test
    @Tag("unit")
    void testNodeLinesFollowLeftmostToken() {
        // Act
        ProgramNode program = parse("x = 1\ny = foo(\n  2)");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        AssignmentNode assignment = (AssignmentNode) program.statements().get(1);
        FunctionCallNode call = (FunctionCallNode) assignment.expression();
        assertThat(assignment.line()).isEqualTo(2);
        assertThat(call.line()).isEqualTo(2);
        assertThat(call.arguments().get(0).line()).isEqualTo(3);
    }

    /**
     * Verifies that after an error the parser skips one token and continues, keeping the
     * statements that follow.
     */
    @Test
    @Tag("unit")
    void testResynchronizationAfterError() {
        // Act
        ProgramNode program = parse(") x = 1");

        // Assert
        assertThat(diagnostics.messages()).containsExactly("error at line 1: expected expression");
        assertThat(program.statements()).hasSize(1);
        assertThat(((AssignmentNode) program.statements().get(0)).target()).isEqualTo("x");
    }

    /**
     * Verifies the diagnostics of malformed function headers and if statements.
     */
    @Test
    @Tag("unit")
    void testHeaderErrors() {
        parse("def (x):");
        assertThat(diagnostics.messages()).first().isEqualTo("error at line 1: expected function name");

        parse("def f x:");
        assertThat(diagnostics.messages()).first().isEqualTo("error at line 1: expected '(' after function name");

        parse("def f(a, 1):");
        assertThat(diagnostics.messages()).startsWith(
                "error at line 1: expected parameter name",
                "error at line 1: expected ')' after parameters");

        parse("def f(a)\n  x = 1");
        assertThat(diagnostics.messages()).first().isEqualTo("error at line 2: expected ':' after function definition");

        parse("if x > 1\n  y = 2");
        assertThat(diagnostics.messages()).first().isEqualTo("error at line 2: expected ':' after if condition");
    }

    /**
     * Verifies that missing closing parentheses are reported while the node is kept.
     */
    @Test
    @Tag("unit")
    void testMissingClosingParenthesis() {
        // Act
        ProgramNode program = parse("x = foo(1");

        // Assert
        assertThat(diagnostics.messages()).containsExactly("error at line 1: expected ')' after arguments");
        assertThat(((AssignmentNode) program.statements().get(0)).expression()).isInstanceOf(FunctionCallNode.class);

        parse("y = (1 + 2");
        assertThat(diagnostics.messages()).containsExactly("error at line 1: expected ')' after expression");

        parse("z = s.(1)");
        assertThat(diagnostics.messages()).first().isEqualTo("error at line 1: expected method name after '.'");
    }

    /**
     * Verifies that a missing right operand leaves an incomplete binary operation in the tree.
     */
    @Test
    @Tag("unit")
    void testMissingRightOperand() {
        // Act
        ProgramNode program = parse("x = 1 +");

        // Assert
        assertThat(diagnostics.messages()).containsExactly("error at line 1: expected expression");
        BinaryOpNode sum = (BinaryOpNode) ((AssignmentNode) program.statements().get(0)).expression();
        assertThat(sum.right()).isNull();
        assertThat(sum.getChildren()).hasSize(1);
    }

    /**
     * Verifies that error tokens are invisible to the parser.
     */
    @Test
    @Tag("unit")
    void testErrorTokensAreIgnored() {
        // Act
        ProgramNode program = parse("x = 5 `");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(program.statements()).hasSize(1);
    }

    /**
     * Verifies that the error line of the report is the line of the first syntax error.
     */
    @Test
    @Tag("unit")
    void testSyntaxReportErrorLine() {
        // Act
        ProgramNode program = parse("x = 1\ny = )\nz = )");
        SyntaxReport report = SyntaxReport.of(program, diagnostics);

        // Assert
        assertThat(report.success()).isFalse();
        assertThat(report.errorLine()).isEqualTo(2);
        assertThat(report.errors()).hasSize(2);

        SyntaxReport clean = SyntaxReport.of(parse("x = 1"), diagnostics);
        assertThat(clean.success()).isTrue();
        assertThat(clean.errorLine()).isZero();
    }

    /**
     * Verifies that deeply nested parentheses are reported once instead of overflowing the stack.
     */
    @Test
    @Tag("unit")
    void testNestingCeilingOnRecursion() {
        // Arrange
        String source = "x = " + "(".repeat(5000) + "1" + ")".repeat(5000);

        // Act
        ProgramNode program = parse(source, 200);

        // Assert
        assertThat(diagnostics.messages()).containsExactly("error at line 1: maximum nesting depth of 200 exceeded");
        assertThat(program.statements()).isEmpty();
    }

    /**
     * Verifies that statements that stay within the ceiling are kept and that a statement
     * whose tree is too tall is dropped on its own.
     */
    @Test
    @Tag("unit")
    void testNestingCeilingOnTreeHeight() {
        // Act
        ProgramNode program = parse("x = 1 + 2\ny = (3)", 2);

        // Assert
        assertThat(diagnostics.messages()).containsExactly("error at line 1: maximum nesting depth of 2 exceeded");
        assertThat(program.statements()).hasSize(1);
        assertThat(((AssignmentNode) program.statements().get(0)).target()).isEqualTo("y");
    }

    /**
     * Verifies that parsing resumes on the next line after a statement exceeded the ceiling,
     * both for nested parentheses and for long operator chains.
     */
    @Test
    @Tag("unit")
    void testNestingCeilingResumesOnNextLine() {
        // Arrange
        String nested = "x = " + "(".repeat(300) + "1" + ")".repeat(300);
        String chain = "z = 1" + " + 1".repeat(210);

        // Act
        ProgramNode program = parse(nested + "\ny = 2\n" + chain + "\nw = 'a'", 200);

        // Assert
        assertThat(diagnostics.messages()).containsExactly(
                "error at line 1: maximum nesting depth of 200 exceeded",
                "error at line 3: maximum nesting depth of 200 exceeded");
        assertThat(program.statements())
                .extracting(statement -> ((AssignmentNode) statement).target())
                .containsExactly("y", "w");
    }

    /**
     * Verifies that an error past the last token is attributed to line 1.
     */
    @Test
    @Tag("unit")
    void testErrorAtEndOfInputUsesLineOne() {
        // Act
        ProgramNode program = parse("x = 1\ny =");
        SyntaxReport report = SyntaxReport.of(program, diagnostics);

        // Assert
        assertThat(diagnostics.messages()).containsExactly("error at line 1: expected expression");
        assertThat(report.errorLine()).isEqualTo(1);
    }

    /**
     * Verifies that an empty source yields an empty program without errors.
     */
    @Test
    @Tag("unit")
    void testEmptySource() {
        // Act
        ProgramNode program = parse("   \n\n# only a comment");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(program.statements()).isEmpty();
        assertThat(program.line()).isEqualTo(1);
    }
}
