package org.minipy.cli;

import com.typesafe.config.Config;
import org.minipy.cli.commands.AnalyzeCommand;
import org.minipy.cli.commands.ServeCommand;
import org.minipy.node.config.ConfigLoader;
import org.minipy.node.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "minipy",
    mixinStandardHelpOptions = true,
    version = "MiniPy Analyzer 1.0",
    description = "Lexical, syntactic and semantic analysis for a small Python subset",
    subcommands = {
        AnalyzeCommand.class,
        ServeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: minipy.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("minipy");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the file given with {@code --config} does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
