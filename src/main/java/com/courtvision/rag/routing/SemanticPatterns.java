package com.courtvision.rag.routing;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Phrase patterns behind the pre-filter checks. All patterns run against the normalized question.
 */
public final class SemanticPatterns {

    // Subjective superlatives: "most exciting", "best player" with no scorer/rebounder/... qualifier
    static final List<Pattern> OPINION_QUALITY = compileAll(
            "\\b(most|best|worst|greatest|coolest|most\\s+\\w+ful)\\b.*\\b(exciting|fun|interesting|dramatic|impressive|thrilling|boring|memorable|legendary|iconic|entertaining|wild|crazy|insane|clutch)\\b",
            "\\b(which|who)\\b.*\\b(most|best|worst)\\b.*\\b(exciting|fun|interesting|impressive|thrilling|iconic|memorable|entertaining|wild|surprising|disappointing)\\b",
            "\\b(most|best|worst)\\s+(exciting|fun|interesting|impressive|thrilling|memorable|entertaining|dramatic|boring|wild|surprising|disappointing|clutch)\\b",
            "\\b(who|which)\\b.*\\b(best|most)\\b.*\\b(player|team|athlete|star)\\b(?!.*\\b(scorer|rebounder|passer|defender|shooter|blocker|handler)\\b)",
            "\\b(wild|crazy|insane|nuts)\\s+(this\\s+year|this\\s+season|right\\s+now)\\b");

    static final List<Pattern> DEBATE_DISCUSSION = compileAll(
            "\\b(do\\s+)?(fans?|people|reddit|community).*(debate|discuss)\\s+(about|on)\\b",
            "\\b(authoritative|expert|verified|official)\\s+(voices?|perspectives?|views?|opinions?).*(say|about|on)\\b",
            "\\b(consensus|popular|common)\\s+(views?|opinions?|perspectives?)\\s+(on|about)\\b",
            "\\bcompare\\s+(opinions?|views?|perspectives?)\\s+(on|about|from)\\b");

    // "explain" alone is not definitional: "explain why they are so effective" is a hybrid ask
    static final List<Pattern> DEFINITIONAL = compileAll(
            "\\b(define|definition)\\b",
            "\\bwhat\\s+(is|does|means?|do)\\b\\s+[a-z]{0,20}(\\s+[a-z]{0,20})?$",
            "\\bwhat\\s+is\\s+a\\b",
            "\\b(meaning\\s+of|refers\\s+to)\\b|\\bwhat\\b.*\\brefers?\\b",
            "\\bexplain\\b\\s+(the\\s+)?(definition|meaning|concept|difference)");

    static final Pattern STATISTICAL_INTENT = Pattern.compile(
            "\\b(who\\s+has|top|highest|lowest|most|fewest|how\\s+many|over|above|below|under"
            + "|find|list|show|get|compare|averaging|players?\\s+averaging)\\b|\\d+",
            PatternGroup.FLAGS);

    private SemanticPatterns() {
    }

    public static boolean isOpinionQuality(QueryText query) {
        return anyFind(OPINION_QUALITY, query.normalized());
    }

    public static boolean isDebateDiscussion(QueryText query) {
        return anyFind(DEBATE_DISCUSSION, query.normalized());
    }

    public static boolean isDefinitional(QueryText query) {
        return anyFind(DEFINITIONAL, query.normalized());
    }

    /**
     * Superlatives, thresholds, counts, listing verbs or any numeric literal.
     */
    public static boolean hasStatisticalIntent(QueryText query) {
        return STATISTICAL_INTENT.matcher(query.normalized()).find();
    }

    static boolean anyFind(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compileAll(String... regexes) {
        return Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, PatternGroup.FLAGS))
                .toList();
    }
}
