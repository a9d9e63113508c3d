package com.dcruver.vault.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the layered frontmatter parser: strict block, line scan, defaults.
 */
class FrontmatterParserTest {

    private FrontmatterParser parser;

    @BeforeEach
    void setUp() {
        parser = new FrontmatterParser();
    }

    @Test
    void testStrictBlock() {
        MarkdownNote note = parser.parse("---\ntitle: X\n---\nBody");

        assertEquals(Map.of("title", "X"), note.getFrontmatter());
        assertEquals("Body", note.getBody());
    }

    @Test
    void testNoMetadataFallsBackToDefaults() {
        String raw = "no metadata here\njust prose";

        MarkdownNote note = parser.parse(raw);

        assertEquals(Map.of("title", "Untitled", "tags", List.of(), "main_topic", "general"), note.getFrontmatter());
        assertEquals(raw, note.getBody());
    }

    @Test
    void testFencedOutputWithLanguageTag() {
        String raw = """
            ```markdown
            ---
            title: "Limits"
            tags: [calculus, 'analysis']
            main_topic: Calculus
            ---
            # Limits
            Text
            ```
            """;

        MarkdownNote note = parser.parse(raw);

        assertEquals("Limits", note.getTitle());
        assertEquals("Calculus", note.getMainTopic());
        assertEquals(List.of("calculus", "analysis"), note.getTags());
        assertEquals("# Limits\nText", note.getBody());
    }

    @Test
    void testFenceWithoutLanguageTag() {
        MarkdownNote note = parser.parse("```\ntitle: X\nrest\n```");

        assertEquals("X", note.getTitle());
        assertEquals("rest", note.getBody());
    }

    @Test
    void testBodyEndingInCodeBlockIsKept() {
        MarkdownNote note = parser.parse("---\ntitle: Code\n---\nExample:\n```java\nint x;\n```");

        assertTrue(note.getBody().endsWith("int x;\n```"));
    }

    @Test
    void testStrictBlockKeepsUnknownKeysAndCoercesScalars() {
        MarkdownNote note = parser.parse("---\ntitle: T\nauthor: Someone\ndraft: true\nversion: 3\n---\nB");

        assertEquals("Someone", note.get("author"));
        assertEquals(Boolean.TRUE, note.get("draft"));
        assertEquals(3, note.get("version"));
    }

    @Test
    void testWindowsLineEndings() {
        MarkdownNote note = parser.parse("---\r\ntitle: X\r\n---\r\nBody");

        assertEquals("X", note.getTitle());
        assertEquals("Body", note.getBody());
    }

    @Test
    void testLineScanStopsAtHeading() {
        String raw = """
            title: Derivatives
            main_topic: calculus
            tags: [math, calculus]

            # Derivatives
            The derivative measures change.
            summary: not metadata
            """;

        MarkdownNote note = parser.parse(raw);

        assertEquals("Derivatives", note.getTitle());
        assertEquals("calculus", note.getMainTopic());
        assertEquals(List.of("math", "calculus"), note.getTags());
        assertNull(note.get("summary"));
        assertEquals("# Derivatives\nThe derivative measures change.\nsummary: not metadata", note.getBody());
    }

    @Test
    void testLineScanScalarTagsAndCaseInsensitiveKeys() {
        MarkdownNote note = parser.parse("Title: Foo\ntags: math\nBody text");

        assertEquals("Foo", note.getTitle());
        assertEquals(List.of("math"), note.get("tags"));
        assertEquals("Body text", note.getBody());
    }

    @Test
    void testLineScanStopsAtMalformedColonLine() {
        MarkdownNote note = parser.parse("summary: short\nNote (important): x\ntitle: Late");

        assertEquals(Map.of("summary", "short"), note.getFrontmatter());
        assertEquals("Note (important): x\ntitle: Late", note.getBody());
    }

    @Test
    void testLineScanIgnoresUnrecognizedKeys() {
        MarkdownNote note = parser.parse("author: Bob\ntitle: T\nbody text");

        assertEquals(Map.of("title", "T"), note.getFrontmatter());
        assertEquals("body text", note.getBody());
    }

    @Test
    void testNullInputIsRejected() {
        assertThrows(NullPointerException.class, () -> parser.parse(null));
    }

    @Test
    void testExtractorsReportNoMatch() {
        assertTrue(new StrictBlockExtractor().extract("plain text").isEmpty());
        assertTrue(new StrictBlockExtractor().extract("---\n\n---\nbody").isEmpty());
        assertTrue(new LineScanExtractor().extract("just prose\nno keys").isEmpty());
    }

    @Test
    void testStrictBlockReadsYamlSequencesAndQuoting() {
        MarkdownNote note = parser.parse("---\ntitle: 'It''s \"here\"'\ntags:\n- math\n- physics\ndate: \"2024\"\n---\nB");

        assertEquals("It's \"here\"", note.getTitle());
        assertEquals(List.of("math", "physics"), note.getTags());
        assertEquals("2024", note.get("date"));
    }

    @Test
    void testInvalidYamlBlockFallsBackToLines() {
        MarkdownNote note = parser.parse("---\ntitle: Limits: An Intro\nmain_topic: calculus\n---\nB");

        assertEquals("Limits: An Intro", note.getTitle());
        assertEquals("calculus", note.getMainTopic());
        assertEquals("B", note.getBody());
    }

    @Test
    void testCommaSeparatedTagsString() {
        MarkdownNote note = parser.parse("---\ntitle: T\ntags: math, physics\n---\nB");

        assertEquals(List.of("math", "physics"), note.getTags());
    }
}
