package com.dcruver.vault.io;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Input formats the document source can read, keyed by file extension.
 */
public enum DocumentFormat {
    MARKDOWN(".md"),
    PLAINTEXT(".txt"),
    JSON(".json"),
    RST(".rst"),
    LATEX(".tex");

    private final String extension;

    DocumentFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static Optional<DocumentFormat> forPath(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(format -> name.endsWith(format.extension))
            .findFirst();
    }
}
