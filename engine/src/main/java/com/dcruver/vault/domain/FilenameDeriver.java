package com.dcruver.vault.domain;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives stable, URL-safe note filenames (without extension) from topic and title.
 */
@Component
public class FilenameDeriver {

    public static final String FALLBACK_NAME = "untitled";

    private static final Pattern UNSAFE = Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SEPARATORS = Pattern.compile("[-\\s]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final int MAX_TITLE_WORDS = 2;
    private static final int MIN_WORD_LENGTH = 4;

    public String derive(String mainTopic, String title) {
        return derive(mainTopic, title, FALLBACK_NAME);
    }

    /**
     * Topic slug, extended by up to two significant title words the topic does not already contain.
     * Falls back to the title slug, then to {@code defaultName}.
     */
    public String derive(String mainTopic, String title, String defaultName) {
        String topic = normalize(mainTopic);
        String titleText = normalize(title);

        String topicSlug = sanitize(topic);
        if (topicSlug.isEmpty()) {
            return fallback(titleText, defaultName);
        }

        String titleSlug = sanitize(titleText);
        if (titleSlug.isEmpty() || titleSlug.equals(topicSlug)) {
            return topicSlug;
        }

        List<String> keyWords = new ArrayList<>();
        for (String word : titleText.split("\\s+")) {
            if (keyWords.size() == MAX_TITLE_WORDS) {
                break;
            }
            if (word.length() >= MIN_WORD_LENGTH && !topic.contains(word)) {
                String slug = sanitize(word);
                if (!slug.isEmpty()) {
                    keyWords.add(slug);
                }
            }
        }

        if (keyWords.isEmpty()) {
            return topicSlug;
        }
        return topicSlug + "-" + String.join("-", keyWords);
    }

    /**
     * Remove unsafe characters, collapse separators into single hyphens, lowercase.
     */
    public String sanitize(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = UNSAFE.matcher(text).replaceAll("");
        cleaned = SEPARATORS.matcher(cleaned).replaceAll("-");
        return trimHyphens(cleaned.toLowerCase(Locale.ROOT));
    }

    private String fallback(String title, String defaultName) {
        String titleSlug = sanitize(title);
        if (!titleSlug.isEmpty()) {
            return titleSlug;
        }
        String defaultSlug = sanitize(defaultName);
        return defaultSlug.isEmpty() ? FALLBACK_NAME : defaultSlug;
    }

    private static String normalize(String text) {
        return text == null ? "" : text.strip().toLowerCase(Locale.ROOT);
    }

    private static String trimHyphens(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '-') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '-') {
            end--;
        }
        return text.substring(start, end);
    }
}
