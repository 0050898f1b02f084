package org.minipy.analyzer.frontend.semantics;

import org.minipy.analyzer.diagnostics.Diagnostic;
import org.minipy.analyzer.diagnostics.DiagnosticsEngine;
import org.minipy.analyzer.frontend.parser.ast.AssignmentNode;
import org.minipy.analyzer.frontend.parser.ast.AstNode;
import org.minipy.analyzer.frontend.parser.ast.BinaryOpNode;
import org.minipy.analyzer.frontend.parser.ast.FunctionCallNode;
import org.minipy.analyzer.frontend.parser.ast.IfStatementNode;
import org.minipy.analyzer.frontend.parser.ast.MethodCallNode;
import org.minipy.analyzer.frontend.parser.ast.ProgramNode;
import org.minipy.analyzer.frontend.semantics.analysis.AnalysisContext;
import org.minipy.analyzer.frontend.semantics.analysis.AssignmentAnalysisHandler;
import org.minipy.analyzer.frontend.semantics.analysis.BinaryOpAnalysisHandler;
import org.minipy.analyzer.frontend.semantics.analysis.CallAnalysisHandler;
import org.minipy.analyzer.frontend.semantics.analysis.IAnalysisHandler;
import org.minipy.analyzer.frontend.semantics.analysis.IfStatementAnalysisHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Performs semantic analysis on the syntax tree: it records assigned variables with their
 * inferred types and checks operators and method calls against those types.
 * <p>
 * The tree is walked in source order and nodes are dispatched to handlers by their class.
 * Nodes without a handler (function definitions, blocks, expression statements, leaves)
 * simply have their children analyzed. Because the walk is single-pass, a variable is only
 * known after the assignment that defines it has been visited.
 * <p>
 * An analyzer instance checks exactly one tree.
 */
public class SemanticAnalyzer implements AnalysisContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final DiagnosticsEngine diagnostics;
    private final VariableTable variables = new VariableTable();
    private final TypeInferrer typeInferrer = new TypeInferrer(variables);
    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();
    private final int maxDepth;
    private int depth = 0;
    private boolean depthExceeded = false;

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param maxDepth The deepest node level that is still analyzed.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, int maxDepth) {
        this.diagnostics = diagnostics;
        this.maxDepth = maxDepth;
        registerDefaultHandlers();
    }

    /**
     * Constructs a semantic analyzer with its own diagnostics engine.
     * @param maxDepth The deepest node level that is still analyzed.
     */
    public SemanticAnalyzer(int maxDepth) {
        this(new DiagnosticsEngine(Diagnostic.Stage.SEMANTIC), maxDepth);
    }

    private void registerDefaultHandlers() {
        handlers.put(AssignmentNode.class, new AssignmentAnalysisHandler());
        handlers.put(IfStatementNode.class, new IfStatementAnalysisHandler());
        handlers.put(BinaryOpNode.class, new BinaryOpAnalysisHandler());
        IAnalysisHandler callHandler = new CallAnalysisHandler();
        handlers.put(FunctionCallNode.class, callHandler);
        handlers.put(MethodCallNode.class, callHandler);
    }

    /**
     * Checks a whole program. This is the main entry point for the semantic phase.
     * @param program The tree to check. A null tree yields an empty, successful report.
     * @return The semantic report.
     */
    public SemanticReport check(ProgramNode program) {
        if (program != null) {
            for (AstNode statement : program.statements()) {
                analyze(statement);
            }
        }
        LOGGER.debug("Semantic pass finished with {} variables and {} errors",
                variables.snapshot().size(), diagnostics.getDiagnostics().size());
        return SemanticReport.of(diagnostics, variables);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node) {
        if (node == null) {
            return;
        }
        depth++;
        try {
            if (depth > maxDepth) {
                if (!depthExceeded) {
                    depthExceeded = true;
                    reportError("maximum nesting depth of " + maxDepth + " exceeded", node.line());
                }
                return;
            }

            IAnalysisHandler handler = handlers.get(node.getClass());
            if (handler != null) {
                handler.analyze(node, this);
            } else {
                for (AstNode child : node.getChildren()) {
                    analyze(child);
                }
            }
        } finally {
            depth--;
        }
    }

    @Override
    public VariableTable variables() {
        return variables;
    }

    @Override
    public VariableType typeOf(AstNode node) {
        return typeInferrer.infer(node);
    }

    @Override
    public void reportError(String message, int line) {
        diagnostics.reportError(message, line);
    }
}
