package io.github.cyfko.truthtable.console;

import io.github.cyfko.truthtable.core.config.TablePolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings of the interactive console.
 *
 * <h2>Sources</h2>
 * Values are read from {@code truthtable.properties} on the classpath. Any key can be overridden
 * with a system property of the same name, e.g. {@code -Dtruthtable.statement-file=data.txt}.
 *
 * <h2>Keys</h2>
 * <ul>
 *   <li><strong>truthtable.statement-file</strong>: file read by menu option 1 (default: {@code statement.txt})</li>
 *   <li><strong>truthtable.rule-width</strong>: width of the {@code ═} separator lines (default: 232)</li>
 *   <li><strong>truthtable.policy</strong>: table policy preset, one of {@code default}, {@code strict},
 *       {@code relaxed} (default: {@code default})</li>
 * </ul>
 *
 * @param statementFile file read by menu option 1
 * @param ruleWidth     width of the separator lines
 * @param tablePolicy   policy of the truth table generator
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ConsoleSettings(
        Path statementFile,
        int ruleWidth,
        TablePolicy tablePolicy
) {

    public static final String RESOURCE = "truthtable.properties";
    public static final String STATEMENT_FILE_KEY = "truthtable.statement-file";
    public static final String RULE_WIDTH_KEY = "truthtable.rule-width";
    public static final String POLICY_KEY = "truthtable.policy";

    public ConsoleSettings {
        Objects.requireNonNull(statementFile, "statementFile cannot be null");
        Objects.requireNonNull(tablePolicy, "tablePolicy cannot be null");
        if (ruleWidth <= 0) {
            throw new IllegalArgumentException("ruleWidth must be positive, got: " + ruleWidth);
        }
    }

    /**
     * Default settings: {@code statement.txt}, rules of 232 characters, default policy.
     *
     * @return default settings
     */
    public static ConsoleSettings defaults() {
        return new ConsoleSettings(Path.of("statement.txt"), 232, TablePolicy.defaults());
    }

    /**
     * Loads the classpath resource and applies system property overrides.
     *
     * @return the effective settings
     * @throws UncheckedIOException     if the resource exists but cannot be read
     * @throws IllegalArgumentException if a value is invalid
     */
    public static ConsoleSettings load() {
        Properties properties = new Properties();
        try (InputStream in = ConsoleSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }

        for (String key : new String[]{STATEMENT_FILE_KEY, RULE_WIDTH_KEY, POLICY_KEY}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return from(properties);
    }

    /**
     * Builds settings from {@code properties}; absent keys keep their default value.
     *
     * @param properties the configuration values
     * @return the settings
     * @throws IllegalArgumentException if a value is invalid
     */
    public static ConsoleSettings from(Properties properties) {
        ConsoleSettings defaults = defaults();

        String file = properties.getProperty(STATEMENT_FILE_KEY);
        Path statementFile = file == null || file.isBlank() ? defaults.statementFile() : Path.of(file.trim());

        String width = properties.getProperty(RULE_WIDTH_KEY);
        int ruleWidth;
        try {
            ruleWidth = width == null ? defaults.ruleWidth() : Integer.parseInt(width.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + RULE_WIDTH_KEY + ": '" + width + "'", e);
        }

        String policy = properties.getProperty(POLICY_KEY);
        TablePolicy tablePolicy = policy == null ? defaults.tablePolicy() : policyOf(policy);

        return new ConsoleSettings(statementFile, ruleWidth, tablePolicy);
    }

    private static TablePolicy policyOf(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "default" -> TablePolicy.defaults();
            case "strict" -> TablePolicy.strict();
            case "relaxed" -> TablePolicy.relaxed();
            default -> throw new IllegalArgumentException(
                    "Unknown " + POLICY_KEY + ": '" + name + "'. Expected one of: default, strict, relaxed");
        };
    }
}
