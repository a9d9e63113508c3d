package com.dcruver.vault.domain.links;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Enriched body plus the targets it now links to.
 */
@Data
@Builder
public class LinkingResult {
    private final String body;
    // Targets of inline links rewritten from bold mentions
    private final List<String> linkedTargets;
    // Targets listed in the Related Topics section
    private final List<String> relatedTargets;
}
