package com.courtvision.rag.routing.fallback;

import com.courtvision.rag.routing.QueryText;
import com.courtvision.rag.routing.QueryType;
import com.courtvision.util.LogSanitizer;
import com.github.benmanes.caffeine.cache.Cache;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Language-model routing. Verdicts are cached per normalized question; a failed call or an unparseable
 * reply routes to {@link QueryType#STATISTICAL} and is not cached.
 */
@Service
@ConditionalOnProperty(prefix = "courtvision.routing.llm-fallback", name = "enabled", havingValue = "true")
public class LlmRoutingClassifier implements RoutingFallbackClassifier {

    private static final Logger log = LoggerFactory.getLogger(LlmRoutingClassifier.class);

    static final QueryType DEFAULT_VERDICT = QueryType.STATISTICAL;

    static final String ROUTER_SYSTEM_PROMPT = """
            You are an NBA query classifier. Classify queries into exactly ONE type:

            sql_only: Statistical queries (numbers, stats, rankings, comparisons)
            - Examples: "Top 5 scorers", "Shai's PPG", "Compare Jokic vs Embiid stats"

            vector_only: Contextual queries (opinions, discussions, explanations, styles)
            - Examples: "Why is LeBron the GOAT?", "What do fans think about the Lakers?", "Explain Curry's playing style"

            hybrid: Biographical or queries needing BOTH stats AND context
            - Examples: "Who is Nikola Jokic?", "Tell me about Luka Doncic", "What makes Giannis valuable?"

            Output ONLY the classification: sql_only, vector_only, or hybrid
            """;

    private final ChatClient chatClient;
    private final Cache<String, QueryType> verdictCache;

    public LlmRoutingClassifier(ChatClient.Builder chatClientBuilder, Cache<String, QueryType> routingFallbackCache) {
        this.chatClient = chatClientBuilder.build();
        this.verdictCache = routingFallbackCache;
    }

    @PostConstruct
    public void init() {
        log.info("LLM routing fallback enabled; heuristic verdicts will be overridden");
    }

    @Override
    public QueryType classify(String query) {
        String key = QueryText.of(query).normalized();
        QueryType cached = this.verdictCache.getIfPresent(key);
        if (cached != null) {
            log.debug("LLM routing cache hit for query {}", LogSanitizer.querySummary(query));
            return cached;
        }
        try {
            String reply = this.chatClient.prompt()
                    .system(ROUTER_SYSTEM_PROMPT)
                    .user("Classify this NBA query:\n\n" + key + "\n\nClassification:")
                    .call()
                    .content();
            QueryType verdict = parseVerdict(reply);
            if (verdict == null) {
                log.warn("Invalid LLM routing verdict '{}', defaulting to {}",
                        LogSanitizer.sanitize(reply), DEFAULT_VERDICT);
                return DEFAULT_VERDICT;
            }
            this.verdictCache.put(key, verdict);
            log.debug("LLM routing verdict {} for query {}", verdict, LogSanitizer.querySummary(query));
            return verdict;
        } catch (Exception e) {
            log.error("LLM routing failed, defaulting to {}: {}", DEFAULT_VERDICT, e.getMessage());
            return DEFAULT_VERDICT;
        }
    }

    /**
     * Reads a single-token verdict. Returns null when the reply is not exactly one of the three tokens.
     */
    static QueryType parseVerdict(String reply) {
        if (reply == null || reply.isBlank()) {
            return null;
        }
        try {
            return QueryType.fromWireValue(reply);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
