package com.dcruver.vault.domain;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A stored index snapshot is readable JSON but not a valid index.
 */
public class MalformedIndexException extends IOException {

    public MalformedIndexException(Path indexPath, String reason) {
        super("Malformed index " + indexPath + ": " + reason);
    }
}
