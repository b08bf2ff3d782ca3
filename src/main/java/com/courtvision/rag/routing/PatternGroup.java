package com.courtvision.rag.routing;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A named, weighted alternation of related patterns that contributes its weight at most once per query.
 */
public record PatternGroup(String name, double weight, Pattern pattern) {

    /**
     * Flags shared by every routing pattern. Unicode classes keep accented names ("Jokić") inside {@code \w}.
     */
    public static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    public PatternGroup {
        Objects.requireNonNull(pattern, "pattern");
        if (name == null || name.isBlank()) {
            throw new PatternTableException(String.valueOf(name), "name must not be blank");
        }
        if (!(weight > 0.0)) {
            throw new PatternTableException(name, "weight must be positive, was " + weight);
        }
    }

    /**
     * Compiles the group's alternation with the shared routing flags.
     *
     * @throws PatternTableException if the regex does not compile or the name/weight is invalid
     */
    public static PatternGroup compile(String name, double weight, String regex) {
        try {
            return new PatternGroup(name, weight, Pattern.compile(regex, FLAGS));
        } catch (PatternSyntaxException e) {
            throw new PatternTableException(name, "invalid regex: " + e.getDescription(), e);
        }
    }

    /**
     * True when any alternative of the group matches anywhere in the normalized question.
     */
    public boolean fires(String normalizedQuery) {
        return this.pattern.matcher(normalizedQuery).find();
    }
}
