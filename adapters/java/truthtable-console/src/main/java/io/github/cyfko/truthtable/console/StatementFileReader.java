package io.github.cyfko.truthtable.console;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads logical statements from a text file, one statement per line.
 * <p>
 * Blank lines are skipped; every other line is trimmed and uppercased. A missing or unreadable
 * file is reported on the output stream and yields an empty list.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class StatementFileReader {

    private static final Logger log = Logger.getLogger(StatementFileReader.class.getName());

    private final PrintStream out;

    /**
     * @param out stream that receives user-facing error lines
     */
    public StatementFileReader(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out cannot be null");
    }

    /**
     * Reads the statements of {@code file}.
     *
     * @param file the statement file
     * @return the statements in file order, possibly empty
     */
    public List<String> read(Path file) {
        Objects.requireNonNull(file, "file cannot be null");

        if (!Files.exists(file)) {
            return fileNotFound(file);
        }

        try {
            List<String> statements = Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .map(line -> line.toUpperCase(Locale.ROOT))
                    .toList();
            log.fine(() -> String.format("Read %d statement(s) from %s", statements.size(), file));
            return statements;
        } catch (NoSuchFileException e) {
            return fileNotFound(file);
        } catch (IOException e) {
            log.log(Level.WARNING, "Failed to read statement file " + file, e);
            out.println("Error reading file: " + e.getMessage());
            return List.of();
        }
    }

    private List<String> fileNotFound(Path file) {
        log.warning(() -> "Statement file not found: " + file.toAbsolutePath());
        out.println("Error: File '" + file + "' not found.");
        return List.of();
    }
}
