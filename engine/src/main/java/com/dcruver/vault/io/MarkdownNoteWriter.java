package com.dcruver.vault.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Writes notes as {@code ---}-delimited YAML frontmatter followed by the body.
 */
@Component
@Slf4j
public class MarkdownNoteWriter {

    static final YAMLMapper YAML_MAPPER = YAMLMapper.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .disable(YAMLGenerator.Feature.SPLIT_LINES)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
        .build();

    /**
     * Write a note to file, keeping a .bak copy of any file it replaces
     */
    public void write(MarkdownNote note, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        if (Files.exists(outputPath)) {
            Path backup = outputPath.resolveSibling(outputPath.getFileName() + ".bak");
            Files.copy(outputPath, backup, StandardCopyOption.REPLACE_EXISTING);
        }

        Files.writeString(outputPath, buildContent(note));
        log.debug("Wrote note to: {}", outputPath);
    }

    /**
     * Build file content from a note
     */
    String buildContent(MarkdownNote note) throws JsonProcessingException {
        StringBuilder sb = new StringBuilder("---\n");

        Map<String, Object> frontmatter = note.getFrontmatter();
        if (frontmatter != null && !frontmatter.isEmpty()) {
            sb.append(YAML_MAPPER.writeValueAsString(frontmatter));
        }

        sb.append("---\n\n");

        if (note.getBody() != null) {
            sb.append(note.getBody());
        }

        // Ensure final newline
        if (sb.charAt(sb.length() - 1) != '\n') {
            sb.append("\n");
        }

        return sb.toString();
    }
}
