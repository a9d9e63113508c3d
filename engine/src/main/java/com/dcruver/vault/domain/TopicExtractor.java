package com.dcruver.vault.domain;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives a note's topics from its level-2 headings.
 */
@Component
public class TopicExtractor {

    private static final Pattern SECTION_HEADING = Pattern.compile("^## (.+)$", Pattern.MULTILINE);
    private static final int MAX_TOPICS = 5;

    public List<String> extractTopics(String body) {
        return SECTION_HEADING.matcher(body).results()
            .map(match -> match.group(1).strip().toLowerCase(Locale.ROOT).replace(" ", "_"))
            .limit(MAX_TOPICS)
            .toList();
    }
}
