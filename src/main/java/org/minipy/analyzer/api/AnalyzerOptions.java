package org.minipy.analyzer.api;

import com.typesafe.config.Config;

/**
 * Tuning knobs of the analyzer.
 *
 * @param maxDepth The deepest nesting the parser and the checker accept before reporting
 *                 {@code maximum nesting depth of N exceeded}.
 */
public record AnalyzerOptions(int maxDepth) {

    /** The defaults, matching {@code reference.conf}. */
    public static final AnalyzerOptions DEFAULT = new AnalyzerOptions(200);

    public AnalyzerOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, was " + maxDepth);
        }
    }

    /**
     * Reads the options from the {@code minipy.analyzer} section.
     * @param config The root configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static AnalyzerOptions fromConfig(Config config) {
        return new AnalyzerOptions(config.getInt("minipy.analyzer.max-depth"));
    }
}
