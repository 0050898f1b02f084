package org.minipy.analyzer.api;

/**
 * Defines the public interface of the MiniPy analyzer.
 */
public interface IAnalyzer {

    /**
     * Runs the scanner, the parser and the semantic checker over one source text.
     * <p>
     * Malformed input never causes an exception; every problem is reported in the returned
     * report.
     *
     * @param source The source code. A null source is treated as empty.
     * @return The combined report of all three stages.
     */
    AnalysisReport analyze(String source);
}
