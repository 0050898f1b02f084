package org.minipy.cli.commands;

import com.typesafe.config.ConfigException;
import org.minipy.analyzer.Analyzer;
import org.minipy.analyzer.api.AnalysisReport;
import org.minipy.analyzer.api.AnalyzerOptions;
import org.minipy.analyzer.api.ReportJsonWriter;
import org.minipy.cli.CommandLineInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

/**
 * Analyzes one source file and prints the JSON report.
 * Exit codes: 0 when the analysis succeeds, 1 when it reports syntax or semantic errors,
 * 2 when the file or the configuration cannot be read.
 */
@Command(name = "analyze", description = "Analyzes a MiniPy source file and prints the JSON report.")
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the source file.")
    private File file;

    @Option(names = "--pretty", description = "Indent the JSON output.")
    private boolean pretty;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter err = spec.commandLine().getErr();

        final AnalyzerOptions options;
        try {
            options = AnalyzerOptions.fromConfig(parent.getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }

        final String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.debug("Failed to read {}", file, e);
            err.println("Error: cannot read file " + file.getPath());
            return 2;
        }

        final AnalysisReport report = new Analyzer(options).analyze(source);
        LOGGER.debug("Analyzed {}: success={}", file, report.success());

        final ReportJsonWriter writer = new ReportJsonWriter();
        final PrintWriter out = spec.commandLine().getOut();
        out.println(pretty ? writer.toPrettyJson(report) : writer.toJson(report));
        out.flush();

        return report.success() ? 0 : 1;
    }
}
