package io.github.cyfko.truthtable.console;

import io.github.cyfko.truthtable.core.config.TablePolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleSettingsTest {

    @Test
    @DisplayName("Missing keys keep their defaults")
    void shouldFallBackToDefaults() {
        assertEquals(ConsoleSettings.defaults(), ConsoleSettings.from(new Properties()));
    }

    @Test
    @DisplayName("Should read every key")
    void shouldReadProperties() {
        Properties properties = new Properties();
        properties.setProperty(ConsoleSettings.STATEMENT_FILE_KEY, " data/statements.txt ");
        properties.setProperty(ConsoleSettings.RULE_WIDTH_KEY, "80");
        properties.setProperty(ConsoleSettings.POLICY_KEY, "Strict");

        ConsoleSettings settings = ConsoleSettings.from(properties);

        assertEquals(Path.of("data/statements.txt"), settings.statementFile());
        assertEquals(80, settings.ruleWidth());
        assertEquals(TablePolicy.strict(), settings.tablePolicy());
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldRejectInvalidValues() {
        Properties badWidth = new Properties();
        badWidth.setProperty(ConsoleSettings.RULE_WIDTH_KEY, "wide");
        assertThrows(IllegalArgumentException.class, () -> ConsoleSettings.from(badWidth));

        Properties zeroWidth = new Properties();
        zeroWidth.setProperty(ConsoleSettings.RULE_WIDTH_KEY, "0");
        assertThrows(IllegalArgumentException.class, () -> ConsoleSettings.from(zeroWidth));

        Properties badPolicy = new Properties();
        badPolicy.setProperty(ConsoleSettings.POLICY_KEY, "lenient");
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> ConsoleSettings.from(badPolicy));
        assertTrue(exception.getMessage().contains("lenient"));
    }

    @Test
    @DisplayName("Should load the bundled resource")
    void shouldLoadResource() {
        ConsoleSettings settings = ConsoleSettings.load();

        assertEquals(Path.of("statement.txt"), settings.statementFile());
        assertEquals(232, settings.ruleWidth());
        assertEquals(TablePolicy.defaults(), settings.tablePolicy());
    }

    @Test
    @DisplayName("System properties override the resource")
    void shouldApplySystemPropertyOverrides() {
        System.setProperty(ConsoleSettings.RULE_WIDTH_KEY, "40");
        try {
            assertEquals(40, ConsoleSettings.load().ruleWidth());
        } finally {
            System.clearProperty(ConsoleSettings.RULE_WIDTH_KEY);
        }
    }
}
