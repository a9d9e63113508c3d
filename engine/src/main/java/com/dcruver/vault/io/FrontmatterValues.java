package com.dcruver.vault.io;

import java.util.ArrayList;
import java.util.List;

/**
 * Value coercion shared by the frontmatter extractors.
 */
final class FrontmatterValues {

    private FrontmatterValues() {
    }

    /**
     * Strip surrounding quotes, then split a bracketed value into a list.
     */
    static Object coerce(String raw) {
        String value = stripQuotes(raw.trim());
        if (value.startsWith("[") && value.endsWith("]")) {
            return splitList(value.substring(1, value.length() - 1));
        }
        return value;
    }

    /**
     * Like {@link #coerce(String)}, but also recognizes booleans and integers.
     */
    static Object coerceScalar(String raw) {
        Object value = coerce(raw);
        if (value instanceof String s) {
            if (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false")) {
                return Boolean.parseBoolean(s);
            }
            if (!s.isEmpty() && s.length() < 10 && s.chars().allMatch(Character::isDigit)) {
                return Integer.parseInt(s);
            }
        }
        return value;
    }

    static List<String> splitList(String inner) {
        List<String> items = new ArrayList<>();
        if (inner.isBlank()) {
            return items;
        }
        for (String item : inner.split(",")) {
            items.add(stripQuotes(item.trim()));
        }
        return items;
    }

    static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isQuote(value.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
