package com.dcruver.vault.io;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses raw model output into frontmatter and body.
 *
 * Extractors are tried in order: strict {@code ---} block, then line scan. When neither
 * finds metadata the default frontmatter is used and the whole text becomes the body.
 * Never fails on malformed input.
 */
@Component
@Slf4j
public class FrontmatterParser {

    public static final String DEFAULT_TITLE = "Untitled";
    public static final String DEFAULT_MAIN_TOPIC = "general";

    private static final Pattern LEADING_FENCE = Pattern.compile("^```[\\w-]*[ \\t]*(\\n|$)");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\n?```\\s*$");

    private final List<FrontmatterExtractor> extractors;

    public FrontmatterParser() {
        this(List.of(new StrictBlockExtractor(), new LineScanExtractor()));
    }

    public FrontmatterParser(List<FrontmatterExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    /**
     * Parse raw generated text
     */
    public MarkdownNote parse(String raw) {
        Objects.requireNonNull(raw, "raw output must not be null");
        String text = stripCodeFence(raw);

        for (FrontmatterExtractor extractor : extractors) {
            Optional<MarkdownNote> note = extractor.extract(text);
            if (note.isPresent()) {
                log.debug("Frontmatter parsed by {}", extractor.getClass().getSimpleName());
                return note.get();
            }
        }

        log.warn("No frontmatter found in generated output, using defaults");
        return MarkdownNote.builder()
            .frontmatter(defaultFrontmatter())
            .body(text)
            .build();
    }

    /**
     * Remove an enclosing code fence, with or without a language tag
     */
    String stripCodeFence(String raw) {
        String text = raw.replace("\r\n", "\n").strip();

        var leading = LEADING_FENCE.matcher(text);
        if (leading.find()) {
            text = text.substring(leading.end());
            text = TRAILING_FENCE.matcher(text).replaceFirst("");
        }

        return text.strip();
    }

    static Map<String, Object> defaultFrontmatter() {
        Map<String, Object> frontmatter = new LinkedHashMap<>();
        frontmatter.put("title", DEFAULT_TITLE);
        frontmatter.put("tags", new ArrayList<String>());
        frontmatter.put("main_topic", DEFAULT_MAIN_TOPIC);
        return frontmatter;
    }
}
