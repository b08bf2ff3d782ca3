package com.courtvision.rag.routing;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Recognizes standalone greetings ("hi", "thanks", "good morning", "how are you?") that need no
 * retrieval at all. Anything carrying a request or basketball content is not a greeting.
 */
@Component
public class GreetingDetector {

    static final int MAX_GREETING_WORDS = 6;

    private static final Pattern QUESTION_GREETING = compile("^(how\\s+(are|r)\\s+you|what's\\s+up)\\??$");
    private static final Pattern SPORTS_KEYWORDS = compile(
            "\\b(player|team|stat|score|point|rebound|assist|game|nba|basketball|lakers|lebron|curry|jordan)\\b");
    private static final Pattern ACTION_REQUESTS = compile(
            "\\b(can\\s+you|could\\s+you|please|show\\s+me|tell\\s+me|give\\s+me|find|search|look\\s+up|help\\s+me\\s+with)\\b");
    private static final Pattern DIGIT = compile("\\d");

    // Whole-question matches only
    private static final List<Pattern> PURE_GREETINGS = List.of(
            compile("^(hi|hello|hey|howdy|greetings|sup|yo|thanks?|thank you|goodbye|bye|see you|farewell|welcome)$"),
            compile("^(hi|hello|hey|thanks?|goodbye|bye)!?$"),
            compile("^(hi|hello|hey)\\s+(there|everyone|all|guys|friends?|folks)!?$"),
            compile("^(how\\s+(are|r)\\s+you|how's\\s+it\\s+going|what's\\s+up|wassup|watsup)\\??$"),
            compile("^(good\\s+(morning|afternoon|evening|night)|good\\s+day)!?$"));

    public boolean isGreeting(String query) {
        if (query == null) {
            return false;
        }
        String q = query.trim().toLowerCase(Locale.ROOT);
        if (q.isEmpty() || q.contains(",")) {
            return false;
        }
        if (q.contains("?") && !QUESTION_GREETING.matcher(q).find()) {
            return false;
        }
        if (SPORTS_KEYWORDS.matcher(q).find() || ACTION_REQUESTS.matcher(q).find() || DIGIT.matcher(q).find()) {
            return false;
        }
        if (q.split("\\s+").length > MAX_GREETING_WORDS) {
            return false;
        }
        return PURE_GREETINGS.stream().anyMatch(p -> p.matcher(q).find());
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, PatternGroup.FLAGS);
    }
}
