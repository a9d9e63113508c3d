package com.dcruver.vault.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The persisted form of the knowledge index.
 */
@Data
@NoArgsConstructor
@JsonPropertyOrder({"version", "last_updated", "stats", "files", "topics_index", "tags_index", "backlinks"})
public class IndexSnapshot {
    public static final int CURRENT_VERSION = 1;

    private int version;
    @JsonProperty("last_updated")
    private LocalDateTime lastUpdated;
    private IndexStats stats;
    private Map<String, FileRecord> files;
    @JsonProperty("topics_index")
    private Map<String, List<String>> topicsIndex;
    @JsonProperty("tags_index")
    private Map<String, List<String>> tagsIndex;
    private Map<String, List<String>> backlinks;

    public static IndexSnapshot empty() {
        IndexSnapshot snapshot = new IndexSnapshot();
        snapshot.setVersion(CURRENT_VERSION);
        snapshot.setLastUpdated(LocalDateTime.now());
        snapshot.setStats(new IndexStats(0, 0));
        snapshot.setFiles(new LinkedHashMap<>());
        snapshot.setTopicsIndex(new LinkedHashMap<>());
        snapshot.setTagsIndex(new LinkedHashMap<>());
        snapshot.setBacklinks(new LinkedHashMap<>());
        return snapshot;
    }
}
