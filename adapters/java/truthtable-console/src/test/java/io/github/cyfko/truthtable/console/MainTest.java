package io.github.cyfko.truthtable.console;

import io.github.cyfko.truthtable.core.impl.BasicTruthTableGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    @DisplayName("Console input is decoded as UTF-8")
    void shouldDecodeUtf8() throws IOException {
        byte[] bytes = "P ∧ Q\n".getBytes(StandardCharsets.UTF_8);

        BufferedReader reader = Main.consoleReader(new ByteArrayInputStream(bytes));

        assertEquals("P ∧ Q", reader.readLine());
        assertNull(reader.readLine());
    }

    @Test
    @DisplayName("Illegal non-ASCII characters are reported intact")
    void shouldReportNonAsciiCharacter() {
        byte[] bytes = "2\nP ∧ Q\n3\n".getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        new TruthTableConsole(
                new BasicTruthTableGenerator(),
                ConsoleSettings.defaults(),
                Main.consoleReader(new ByteArrayInputStream(bytes)),
                new PrintStream(buffer, true, StandardCharsets.UTF_8)
        ).run();

        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("Error: Unexpected character '∧' at position 2"));
    }
}
