package org.minipy.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.minipy.cli.CommandLineInterface;
import org.minipy.node.processes.http.HttpServerProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Runs the HTTP analysis service in the foreground until the JVM is shut down.
 */
@Command(name = "serve", description = "Starts the HTTP analysis service.")
public class ServeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final Config config;
        try {
            config = parent.getConfig();
        } catch (ConfigException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 2;
        }

        final HttpServerProcess server = new HttpServerProcess(config);
        final CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutdown requested, stopping HTTP server...");
            server.stop();
            stopped.countDown();
        }, "minipy-shutdown"));

        server.start();

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.stop();
        }
        return 0;
    }
}
