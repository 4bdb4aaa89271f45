package io.chainrun.cli;

import io.chainrun.cli.commands.ChainrunCli;
import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;

/// Process entry point: installs the bundled logging configuration and runs the CLI.
public final class Main {

    private static final String LOGGING_CONFIG = "/logging.properties";

    private Main() {}

    public static void main(String[] args) {
        configureLogging();
        System.exit(ChainrunCli.commandLine().execute(args));
    }

    /// Reads `logging.properties` from the classpath unless the JVM was started with
    /// `java.util.logging.config.file`.
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging configuration: " + e.getMessage());
        }
    }
}
