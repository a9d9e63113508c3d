package com.dcruver.vault.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a well-formed {@code ---} delimited block at the top of the text.
 * The block is read as YAML; when it is not a valid YAML mapping, each {@code key: value}
 * line is read on its own. Every key in the block is kept, recognized or not.
 */
@Slf4j
public class StrictBlockExtractor implements FrontmatterExtractor {

    private static final Pattern BLOCK = Pattern.compile("^---\\n(.*?)\\n---\\n(.*)$", Pattern.DOTALL);
    private static final YAMLMapper YAML_MAPPER = new YAMLMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAPPING = new TypeReference<>() {
    };

    @Override
    public Optional<MarkdownNote> extract(String text) {
        Matcher matcher = BLOCK.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        Map<String, Object> frontmatter = readYaml(matcher.group(1))
            .orElseGet(() -> parseBlock(matcher.group(1)));
        if (frontmatter.isEmpty()) {
            log.debug("Frontmatter block present but contains no keys");
            return Optional.empty();
        }

        return Optional.of(MarkdownNote.builder()
            .frontmatter(frontmatter)
            .body(matcher.group(2))
            .build());
    }

    private Optional<Map<String, Object>> readYaml(String block) {
        Map<String, Object> parsed;
        try {
            parsed = YAML_MAPPER.readValue(block, MAPPING);
        } catch (JsonProcessingException e) {
            log.warn("YAML frontmatter parsing failed, reading lines instead: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (parsed == null) {
            return Optional.empty();
        }

        Map<String, Object> frontmatter = new LinkedHashMap<>();
        parsed.forEach((key, value) -> frontmatter.put(key, normalize(value)));
        return Optional.of(frontmatter);
    }

    /**
     * Nulls become empty strings and list items become strings
     */
    private static Object normalize(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof List<?> list) {
            List<String> items = new ArrayList<>();
            for (Object item : list) {
                items.add(item == null ? "" : item.toString());
            }
            return items;
        }
        return value;
    }

    private Map<String, Object> parseBlock(String block) {
        Map<String, Object> frontmatter = new LinkedHashMap<>();

        for (String line : block.split("\n")) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }

            String key = line.substring(0, colon).trim();
            if (key.isEmpty()) {
                continue;
            }
            frontmatter.put(key, FrontmatterValues.coerceScalar(line.substring(colon + 1)));
        }

        return frontmatter;
    }
}
