package com.dcruver.vault.io;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A Markdown note split into its frontmatter mapping and body text.
 * Frontmatter values are scalars (String, Boolean, Integer) or lists of strings.
 */
@Data
@Builder
@With
public class MarkdownNote {
    private final Map<String, Object> frontmatter;
    private final String body;

    /**
     * Get frontmatter value
     */
    public Object get(String key) {
        return frontmatter != null ? frontmatter.get(key) : null;
    }

    public boolean has(String key) {
        Object value = get(key);
        return value != null && !value.toString().isBlank();
    }

    public String getTitle() {
        return has("title") ? get("title").toString() : null;
    }

    public String getMainTopic() {
        return has("main_topic") ? get("main_topic").toString() : null;
    }

    /**
     * Tags as a list. A scalar value is treated as a comma-separated list.
     */
    public List<String> getTags() {
        Object value = get("tags");
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            List<String> tags = new ArrayList<>();
            for (Object item : list) {
                tags.add(item.toString());
            }
            return tags;
        }
        return Arrays.stream(value.toString().split(","))
            .map(String::trim)
            .filter(t -> !t.isEmpty())
            .toList();
    }
}
