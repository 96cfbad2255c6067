package io.github.cyfko.truthtable.console;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatementFileReader Tests")
class StatementFileReaderTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream buffer;
    private StatementFileReader reader;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        reader = new StatementFileReader(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should trim, uppercase and skip blank lines")
    void shouldReadStatements() throws IOException {
        Path file = tempDir.resolve("statement.txt");
        Files.writeString(file, "p or ~p\n\n   \n  (p -> q) ^ r  \nP IFF Q\n");

        List<String> statements = reader.read(file);

        assertEquals(List.of("P OR ~P", "(P -> Q) ^ R", "P IFF Q"), statements);
        assertEquals("", output());
    }

    @Test
    @DisplayName("Should report a missing file")
    void shouldReportMissingFile() {
        Path file = tempDir.resolve("missing.txt");

        assertEquals(List.of(), reader.read(file));
        assertTrue(output().contains("Error: File '" + file + "' not found."));
    }

    @Test
    @DisplayName("Should report an unreadable path")
    void shouldReportReadError() {
        assertEquals(List.of(), reader.read(tempDir));
        assertTrue(output().startsWith("Error reading file:"));
    }

    @Test
    @DisplayName("Should return nothing for an empty file")
    void shouldHandleEmptyFile() throws IOException {
        Path file = Files.createFile(tempDir.resolve("empty.txt"));
        assertTrue(reader.read(file).isEmpty());
        assertEquals("", output());
    }
}
