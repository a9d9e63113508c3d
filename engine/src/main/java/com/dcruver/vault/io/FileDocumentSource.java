package com.dcruver.vault.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads text-based documents from the local file system.
 * JSON documents are re-emitted pretty-printed so the model sees a stable layout.
 */
@Component
@Slf4j
public class FileDocumentSource implements DocumentSource {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public LoadedDocument load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }

        DocumentFormat format = DocumentFormat.forPath(path)
            .orElseThrow(() -> new UnsupportedDocumentFormatException(path));

        String content = switch (format) {
            case JSON -> readJson(path);
            case MARKDOWN, PLAINTEXT, RST, LATEX -> Files.readString(path);
        };

        log.debug("Loaded {} document {} ({} chars)", format, path.getFileName(), content.length());

        return LoadedDocument.builder()
            .content(content)
            .fileName(path.getFileName().toString())
            .format(format)
            .build();
    }

    private String readJson(Path path) throws IOException {
        JsonNode tree = objectMapper.readTree(path.toFile());
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
    }
}
