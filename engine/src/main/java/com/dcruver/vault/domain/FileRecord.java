package com.dcruver.vault.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Index entry for a single note.
 * The filename is the key of the snapshot's files map and is not repeated in the entry.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FileRecord {
    @JsonIgnore
    private String filename;

    private String title;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    @Builder.Default
    private List<String> topics = new ArrayList<>();
    private LocalDate created;
    private LocalDate updated;
    @JsonProperty("size_chars")
    private int sizeChars;
    private String parent;
    @Builder.Default
    private List<String> related = new ArrayList<>();

    /**
     * Deep copy, so callers never alias the index's lists
     */
    public FileRecord copy() {
        return toBuilder()
            .tags(new ArrayList<>(tags))
            .topics(new ArrayList<>(topics))
            .related(new ArrayList<>(related))
            .build();
    }
}
