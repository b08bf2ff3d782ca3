package com.courtvision.rag.routing.metadata;

import com.courtvision.rag.routing.PatternGroup;
import com.courtvision.rag.routing.QueryStyleCategory;
import com.courtvision.rag.routing.QueryText;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Categorizes how a question is phrased. Noisy is checked first, then Complex, then Conversational;
 * anything else is Simple.
 */
public class QueryStyleClassifier {

    private record StyleRule(QueryStyleCategory category, List<Predicate<QueryText>> signals) {
        boolean matches(QueryText query) {
            return this.signals.stream().anyMatch(signal -> signal.test(query));
        }
    }

    // === NOISY ===
    private static final Pattern SLANG = compile("\\b(lmao|bro|fr|imho|tbh|yo|lol|bruh|fam|ain't|plz|pls)\\b");
    // "n" for "and", "2" for "to", "u", "r", "da"
    private static final Pattern CHAT_ABBREVIATIONS = compile("\\b(n\\s+|2\\s+|da\\s+|u\\s+|r\\s+)\\b");
    private static final Pattern TYPOS = compile("\\b(plzzz|szn|whos|whats|dont|cant|isnt|wont|shouldnt)\\b");
    private static final Pattern REPEATED_PUNCTUATION = compile("(\\?\\?+|!!+|\\.\\.\\.+)");
    private static final Pattern OUT_OF_SCOPE = compile(
            "\\b(weather|recipe|cook|bake|baking|politics|stock|finance|video\\s*game|computer|tech|restaurant)\\b");
    private static final Pattern INJECTION = compile("(<script>|drop\\s+table|\\.\\./|\\{\\{|<%=)");
    private static final Pattern GREETING_WORD = compile("^(hi|hello|hey|thanks|bye|goodbye)$");

    // === COMPLEX ===
    private static final Pattern SYNTHESIS = compile("\\b(analyze|synthesize|patterns|evolution|trend|sentiment|consensus)\\b");
    private static final Pattern MULTIPART = compile("\\b(and explain|and why|what does this reveal|what makes)\\b");
    private static final Pattern CROSS_REFERENCE = compile("\\b(compare opinions|how do .* differ from)\\b");
    private static final Pattern STRATEGIC = compile("\\b(strategy|historically|future|generational|correlation)\\b");

    // === CONVERSATIONAL ===
    private static final Pattern PRONOUNS = compile("\\b(his|her|their|them|he|she|they)\\b");
    private static final Pattern FOLLOW_UP = compile("\\b(what about|how about|tell me more|and what|what else)\\b");
    private static final Pattern CORRECTION = compile("\\b(actually|i meant|no i mean|sorry i meant)\\b");
    private static final Pattern TOPIC_SWITCH = compile("\\b(going back to|returning to|back to)\\b");
    private static final Pattern PROGRESSIVE_FILTER = compile("\\b(only from|sort them|just the|filter)\\b");
    private static final Pattern CORE_INTENT = compile("\\b(top|most|best|who|what|how many|how much|count|average|total)\\b");

    private static final List<StyleRule> LADDER = List.of(
            new StyleRule(QueryStyleCategory.NOISY, List.of(
                    q -> find(SLANG, q.normalized()),
                    q -> find(CHAT_ABBREVIATIONS, q.normalized()),
                    q -> find(TYPOS, q.normalized()),
                    q -> find(REPEATED_PUNCTUATION, q.original()),
                    q -> find(OUT_OF_SCOPE, q.normalized()),
                    q -> find(INJECTION, q.normalized()),
                    q -> q.wordCount() == 1 && !find(GREETING_WORD, q.normalized()),
                    QueryStyleClassifier::isKeywordStuffed)),
            new StyleRule(QueryStyleCategory.COMPLEX, List.of(
                    q -> find(SYNTHESIS, q.normalized()),
                    q -> find(MULTIPART, q.normalized()),
                    q -> find(CROSS_REFERENCE, q.normalized()),
                    q -> q.wordCount() > 15,
                    q -> find(STRATEGIC, q.normalized()),
                    q -> occurrences(q.normalized(), " and ") >= 2 || occurrences(q.normalized(), ",") >= 2)),
            new StyleRule(QueryStyleCategory.CONVERSATIONAL, List.of(
                    q -> find(PRONOUNS, q.normalized()),
                    q -> find(FOLLOW_UP, q.normalized()),
                    q -> find(CORRECTION, q.normalized()),
                    q -> find(TOPIC_SWITCH, q.normalized()),
                    q -> find(PROGRESSIVE_FILTER, q.normalized()),
                    q -> q.wordCount() < 5 && !find(CORE_INTENT, q.normalized()))));

    public QueryStyleCategory classify(QueryText query) {
        for (StyleRule rule : LADDER) {
            if (rule.matches(query)) {
                return rule.category();
            }
        }
        return QueryStyleCategory.SIMPLE;
    }

    static boolean isKeywordStuffed(QueryText query) {
        Map<String, Integer> counts = new HashMap<>();
        for (String word : query.words()) {
            if (counts.merge(word, 1, Integer::sum) >= 3) {
                return true;
            }
        }
        return false;
    }

    static int occurrences(String text, String token) {
        int count = 0;
        int from = text.indexOf(token);
        while (from >= 0) {
            count++;
            from = text.indexOf(token, from + token.length());
        }
        return count;
    }

    private static boolean find(Pattern pattern, String text) {
        return pattern.matcher(text).find();
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, PatternGroup.FLAGS);
    }
}
