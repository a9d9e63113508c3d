package com.dcruver.vault.io;

import lombok.Builder;
import lombok.Data;

/**
 * Text content of an input document.
 */
@Data
@Builder
public class LoadedDocument {
    private final String content;
    private final String fileName;
    private final DocumentFormat format;
}
