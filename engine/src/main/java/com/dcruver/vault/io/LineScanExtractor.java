package com.dcruver.vault.io;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Permissive extractor for output that carries {@code key: value} lines without delimiters.
 * Scanning stops at the first heading or at the first line with a colon that is not a
 * {@code key: value} pair; the body is whatever follows the last metadata line consumed.
 */
@Slf4j
public class LineScanExtractor implements FrontmatterExtractor {

    static final Set<String> RECOGNIZED_KEYS = Set.of("title", "main_topic", "date", "summary", "tags");

    private static final Pattern KEY_VALUE = Pattern.compile("^\\s*([\\w-]+)\\s*:(.*)$");

    @Override
    public Optional<MarkdownNote> extract(String text) {
        List<String> lines = List.of(text.split("\n", -1));
        Map<String, Object> frontmatter = new LinkedHashMap<>();
        int contentStart = 0;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);

            if (line.startsWith("#")) {
                break;
            }
            if (!line.contains(":")) {
                continue;
            }

            Matcher matcher = KEY_VALUE.matcher(line);
            if (!matcher.matches()) {
                break;
            }

            String key = matcher.group(1).toLowerCase(Locale.ROOT);
            if (!RECOGNIZED_KEYS.contains(key)) {
                continue;
            }

            Object value = FrontmatterValues.coerce(matcher.group(2));
            if (key.equals("tags") && value instanceof String tag) {
                value = tag.isEmpty() ? List.of() : List.of(tag);
            }
            frontmatter.put(key, value);
            contentStart = i + 1;
        }

        if (frontmatter.isEmpty()) {
            return Optional.empty();
        }

        log.info("Frontmatter extracted from content lines: {}", frontmatter.keySet());
        String body = String.join("\n", lines.subList(contentStart, lines.size())).strip();
        return Optional.of(MarkdownNote.builder()
            .frontmatter(frontmatter)
            .body(body)
            .build());
    }
}
