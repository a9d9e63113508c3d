package com.dcruver.vault.io;

import java.io.IOException;
import java.nio.file.Path;

public class UnsupportedDocumentFormatException extends IOException {

    public UnsupportedDocumentFormatException(Path path) {
        super("Unsupported format: " + path.getFileName());
    }
}
