package com.courtvision.rag.routing;

import static com.courtvision.constant.BasketballVocabulary.BIOGRAPHICAL_NAMES;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Detects questions about a specific player or team ("Who is LeBron?", "Tell me about the Celtics").
 *
 * <p>Exclusions win over inclusions: "Tell me about the most discussed topic" and
 * "What do fans debate about Curry?" are about discussions, not people.</p>
 */
public class BiographicalDetector {

    private static final List<Pattern> EXCLUSIONS = List.of(
            Pattern.compile("\\b(most\\s+)?(discussed|popular|controversial|trending)\\s+(topic|debate|discussion|issue|question|opinion|view)\\b", PatternGroup.FLAGS),
            Pattern.compile("\\b(topic|debate|discussion|opinions?|views?|perspectives?)\\s+(about|on|regarding)\\b", PatternGroup.FLAGS),
            Pattern.compile("\\b(what\\s+do|do)\\s+(fans?|people|reddit|community)\\b", PatternGroup.FLAGS),
            Pattern.compile("\\b(authoritative|expert|verified|official)\\s+(voices?|perspectives?|views?|opinions?)\\b", PatternGroup.FLAGS),
            Pattern.compile("\\b(consensus|popular|common)\\s+(views?|opinions?|perspectives?)\\b", PatternGroup.FLAGS));

    private static final Pattern KNOWN_NAME = Pattern.compile(
            "\\b(who\\s+is|who.?s|who\\s+are|tell\\s+me\\s+about|gimme\\s+the\\s+scoop\\s+on|info\\s+on|about)\\b.*\\b("
            + BIOGRAPHICAL_NAMES + ")\\b", PatternGroup.FLAGS);

    // Case-sensitive: the capital letter is the signal. Determiners and quantifiers are not names.
    private static final Pattern CAPITALIZED_NAME = Pattern.compile(
            "(?i:\\bwho\\s+is|\\bwho.?s|\\btell\\s+me\\s+about)\\s+"
            + "(?!(?i:the|their|a|an|more|most|less|least|your|my|our|his|her|this|that|these|those)\\b)"
            + "(\\p{Lu}[\\p{L}\\p{N}]*)",
            Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern BACKGROUND = Pattern.compile(
            "\\b(background|history|biography|bio|career|rise\\s+of|story\\s+of)\\b.*\\b(player|athlete|team)\\b",
            PatternGroup.FLAGS);

    public boolean isBiographical(QueryText query) {
        String normalized = query.normalized();
        for (Pattern exclusion : EXCLUSIONS) {
            if (exclusion.matcher(normalized).find()) {
                return false;
            }
        }
        return KNOWN_NAME.matcher(normalized).find()
                || CAPITALIZED_NAME.matcher(query.original()).find()
                || BACKGROUND.matcher(normalized).find();
    }
}
