package com.dcruver.vault.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate counts, always recomputable from the file records.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndexStats {
    @JsonProperty("total_files")
    private int totalFiles;
    @JsonProperty("total_links")
    private int totalLinks;
}
