package com.dcruver.vault.domain;

import lombok.Data;

/**
 * A file ranked by similarity to another.
 */
@Data
public class RelatedFile {
    private final String filename;
    private final double score;
}
