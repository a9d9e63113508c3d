package com.dcruver.vault.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileDocumentSourceTest {

    private FileDocumentSource source;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        source = new FileDocumentSource();
    }

    @Test
    void testLoadsMarkdown() throws Exception {
        Path file = tempDir.resolve("Lecture.MD");
        Files.writeString(file, "# Lecture\nТеорема Пифагора");

        LoadedDocument document = source.load(file);

        assertEquals("# Lecture\nТеорема Пифагора", document.getContent());
        assertEquals("Lecture.MD", document.getFileName());
        assertEquals(DocumentFormat.MARKDOWN, document.getFormat());
    }

    @Test
    void testJsonIsPrettyPrinted() throws Exception {
        Path file = tempDir.resolve("data.json");
        Files.writeString(file, "{\"a\":1,\"b\":[\"x\"]}");

        LoadedDocument document = source.load(file);

        assertEquals(DocumentFormat.JSON, document.getFormat());
        assertTrue(document.getContent().contains("\"a\" : 1"));
        assertTrue(document.getContent().contains("\n"));
    }

    @Test
    void testBinaryFormatsAreRejected() throws Exception {
        Path file = tempDir.resolve("paper.pdf");
        Files.writeString(file, "%PDF-1.4");

        assertThrows(UnsupportedDocumentFormatException.class, () -> source.load(file));
    }

    @Test
    void testMissingFile() {
        assertThrows(NoSuchFileException.class, () -> source.load(tempDir.resolve("missing.txt")));
    }
}
