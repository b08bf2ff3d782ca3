package com.courtvision.rag.routing;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A question prepared once for every routing stage.
 *
 * @param original   the trimmed question in its original casing
 * @param normalized lower-cased, dash-unified, whitespace-collapsed form
 * @param words      whitespace-separated tokens of the lower-cased question
 */
public record QueryText(String original, String normalized, List<String> words) {

    private static final Pattern DASHES = Pattern.compile("\\s*[\\u2014\\u2013]\\s*|\\s+-\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static QueryText of(String query) {
        String original = query == null ? "" : query.trim();
        String lower = original.toLowerCase(Locale.ROOT);
        List<String> words = lower.isEmpty() ? List.of() : List.of(WHITESPACE.split(lower));
        String unified = DASHES.matcher(lower).replaceAll(" - ");
        String normalized = WHITESPACE.matcher(unified).replaceAll(" ").trim();
        return new QueryText(original, normalized, words);
    }

    public int wordCount() {
        return this.words.size();
    }

    public boolean isEmpty() {
        return this.normalized.isEmpty();
    }
}
