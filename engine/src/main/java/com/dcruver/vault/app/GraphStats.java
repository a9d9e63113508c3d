package com.dcruver.vault.app;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Vault-level statistics.
 */
@Data
@Builder
public class GraphStats {
    @JsonProperty("total_files")
    private final int totalFiles;
    @JsonProperty("total_links")
    private final int totalLinks;
    @JsonProperty("unique_topics")
    private final int uniqueTopics;
    @JsonProperty("unique_tags")
    private final int uniqueTags;
}
