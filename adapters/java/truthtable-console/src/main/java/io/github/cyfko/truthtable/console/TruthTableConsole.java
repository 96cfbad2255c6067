package io.github.cyfko.truthtable.console;

import io.github.cyfko.truthtable.core.api.TruthTableGenerator;
import io.github.cyfko.truthtable.core.api.TruthTableOutcome;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Menu-driven console around a {@link TruthTableGenerator}.
 *
 * <p>The loop offers three choices until the user exits or the input ends:</p>
 * <ol>
 *   <li>tabulate every statement of the configured statement file</li>
 *   <li>tabulate one statement typed by the user</li>
 *   <li>exit</li>
 * </ol>
 * <p>
 * Outcomes without a table are printed as {@code Error: ...} lines and the loop goes on.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TruthTableConsole {

    private static final Logger log = Logger.getLogger(TruthTableConsole.class.getName());

    static final String INVALID_CHOICE = "Invalid choice. Please try again.";
    static final String EMPTY_STATEMENT = "Error: No logical statement provided. Please try again.";
    static final String GOODBYE = "Exiting the Truth Table Generator. Goodbye!";
    static final String CHOICE_PROMPT = "Enter your choice (1/2/3): ";
    static final String STATEMENT_PROMPT = "Enter your logical statement: ";

    private final TruthTableGenerator generator;
    private final ConsoleSettings settings;
    private final StatementFileReader statementReader;
    private final TruthTableRenderer renderer;
    private final BufferedReader in;
    private final PrintStream out;
    private final String rule;

    public TruthTableConsole(TruthTableGenerator generator, ConsoleSettings settings, BufferedReader in, PrintStream out) {
        this(generator, settings, new StatementFileReader(out), new TruthTableRenderer(), in, out);
    }

    public TruthTableConsole(
            TruthTableGenerator generator,
            ConsoleSettings settings,
            StatementFileReader statementReader,
            TruthTableRenderer renderer,
            BufferedReader in,
            PrintStream out
    ) {
        this.generator = Objects.requireNonNull(generator, "generator cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.statementReader = Objects.requireNonNull(statementReader, "statementReader cannot be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer cannot be null");
        this.in = Objects.requireNonNull(in, "in cannot be null");
        this.out = Objects.requireNonNull(out, "out cannot be null");
        this.rule = "═".repeat(settings.ruleWidth());
    }

    /**
     * Prints the banner and runs the menu loop until the user exits or the input is exhausted.
     */
    public void run() {
        printBanner();
        try {
            boolean running = true;
            while (running) {
                printMenu();
                String choice = in.readLine();
                if (choice == null) {
                    log.fine("Input closed, leaving the menu loop");
                    break;
                }
                running = switch (choice.trim()) {
                    case "1" -> {
                        tabulateStatementFile();
                        yield true;
                    }
                    case "2" -> tabulateTypedStatement();
                    case "3" -> {
                        printGoodbye();
                        yield false;
                    }
                    default -> {
                        out.println(INVALID_CHOICE);
                        yield true;
                    }
                };
            }
        } catch (IOException e) {
            log.log(Level.SEVERE, "Failed to read console input", e);
            out.println("Error reading input: " + e.getMessage());
        }
        out.flush();
    }

    private void tabulateStatementFile() {
        List<String> statements = statementReader.read(settings.statementFile());
        for (String statement : statements) {
            out.println(rule);
            out.println();
            out.println("Evaluating logical statement: " + statement);
            tabulate(statement);
        }
    }

    /**
     * @return false if the input ended before a statement was read
     */
    private boolean tabulateTypedStatement() throws IOException {
        out.println(rule);
        out.println();
        out.print(STATEMENT_PROMPT);
        out.flush();

        String line = in.readLine();
        if (line == null) {
            return false;
        }
        String statement = line.trim().toUpperCase(Locale.ROOT);
        if (statement.isEmpty()) {
            out.println(EMPTY_STATEMENT);
        } else {
            tabulate(statement);
        }
        return true;
    }

    void tabulate(String statement) {
        TruthTableOutcome outcome;
        try {
            outcome = generator.buildTable(statement);
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "Unexpected failure while tabulating '" + statement + "'", e);
            out.println("Error: " + e.getMessage());
            return;
        }

        if (outcome.isTable()) {
            out.println("Truth Table:");
            renderer.renderLines(outcome.table().orElseThrow()).forEach(out::println);
        } else {
            out.println("Error: " + outcome.message());
        }
    }

    private void printBanner() {
        out.println(rule);
        out.println(centered("TRUTH TABLE GENERATOR"));
        out.println(centered("WELCOME!"));
        out.println(centered("Use the variables P, Q, R"));
        out.println(centered("Logical Operators: ~, ^, or, ->, <->"));
    }

    private void printMenu() {
        out.println(rule);
        out.println("Choose an option:");
        out.println("1. Read logical statements from a file");
        out.println("2. Enter a logical statement");
        out.println("3. Exit");
        out.print(CHOICE_PROMPT);
        out.flush();
    }

    private void printGoodbye() {
        out.println(rule);
        out.println(centered(GOODBYE));
        out.println(rule);
        out.println();
    }

    private String centered(String text) {
        return TruthTableRenderer.center(text, settings.ruleWidth()).stripTrailing();
    }
}
