package org.minipy.analyzer;

import org.minipy.analyzer.api.AnalysisReport;
import org.minipy.analyzer.api.AnalyzerOptions;
import org.minipy.analyzer.api.IAnalyzer;
import org.minipy.analyzer.diagnostics.Diagnostic;
import org.minipy.analyzer.diagnostics.DiagnosticsEngine;
import org.minipy.analyzer.frontend.lexer.Lexer;
import org.minipy.analyzer.frontend.lexer.LexicalReport;
import org.minipy.analyzer.frontend.parser.Parser;
import org.minipy.analyzer.frontend.parser.SyntaxReport;
import org.minipy.analyzer.frontend.parser.ast.ProgramNode;
import org.minipy.analyzer.frontend.semantics.SemanticAnalyzer;
import org.minipy.analyzer.frontend.semantics.SemanticReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main analyzer implementation. It runs the three stages in order: the scanner, the
 * parser over the scanned tokens, and the semantic checker over the parsed tree. Every
 * stage runs regardless of errors in the previous one.
 * <p>
 * Each call allocates its own stage objects, so an instance is immutable and can be
 * shared between threads.
 */
public class Analyzer implements IAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Analyzer.class);

    private final AnalyzerOptions options;

    /**
     * Creates an analyzer with default options.
     */
    public Analyzer() {
        this(AnalyzerOptions.DEFAULT);
    }

    /**
     * Creates an analyzer.
     * @param options The analyzer options.
     */
    public Analyzer(AnalyzerOptions options) {
        this.options = options;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public AnalysisReport analyze(String source) {
        // Phase 1: Lexical analysis
        Lexer lexer = new Lexer(source, new DiagnosticsEngine(Diagnostic.Stage.LEXICAL));
        LexicalReport lexical = lexer.scan();

        // Phase 2: Parsing
        DiagnosticsEngine syntaxDiagnostics = new DiagnosticsEngine(Diagnostic.Stage.SYNTAX);
        Parser parser = new Parser(lexical.tokens(), syntaxDiagnostics, options.maxDepth());
        ProgramNode program = parser.parse();
        SyntaxReport syntax = SyntaxReport.of(program, syntaxDiagnostics);

        // Phase 3: Semantic analysis
        SemanticAnalyzer semanticAnalyzer = new SemanticAnalyzer(
                new DiagnosticsEngine(Diagnostic.Stage.SEMANTIC), options.maxDepth());
        SemanticReport semantic = semanticAnalyzer.check(program);

        AnalysisReport report = AnalysisReport.of(lexical, syntax, semantic);
        LOGGER.debug("Analysis finished: {} tokens, {} lexical / {} syntax / {} semantic errors, success={}",
                lexical.tokens().size(), lexical.errors().size(), syntax.errors().size(),
                semantic.errors().size(), report.success());
        return report;
    }
}
