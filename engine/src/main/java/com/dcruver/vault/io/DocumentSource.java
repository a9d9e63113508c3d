package com.dcruver.vault.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Supplies the text of an input document.
 */
public interface DocumentSource {

    LoadedDocument load(Path path) throws IOException;
}
