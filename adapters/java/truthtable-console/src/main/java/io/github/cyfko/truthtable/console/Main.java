package io.github.cyfko.truthtable.console;

import io.github.cyfko.truthtable.core.impl.BasicTruthTableGenerator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point of the truth table console.
 * <p>
 * Loads {@code logging.properties} and {@link ConsoleSettings}, then runs a
 * {@link TruthTableConsole} over standard input and output. Input is decoded as UTF-8.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Main {

    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {}

    public static void main(String[] args) {
        configureLogging();

        ConsoleSettings settings = ConsoleSettings.load();
        log.fine(() -> "Console settings: " + settings);

        BufferedReader in = consoleReader(System.in);
        new TruthTableConsole(new BasicTruthTableGenerator(settings.tablePolicy()), settings, in, System.out).run();
    }

    static BufferedReader consoleReader(InputStream in) {
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    private static void configureLogging() {
        try (InputStream config = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "Could not load logging.properties, keeping the JVM defaults", e);
        }
    }
}
