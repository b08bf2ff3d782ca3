package com.courtvision.rag.routing;

import com.courtvision.rag.routing.metadata.ComplexityDepthEstimator;
import com.courtvision.rag.routing.metadata.ExpansionCountEstimator;
import com.courtvision.rag.routing.metadata.QueryStyleClassifier;
import com.courtvision.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Routes a basketball question to statistical lookup, contextual search, or both.
 *
 * <p>Pipeline:</p>
 * <ol>
 *   <li>Normalize the question once</li>
 *   <li>Estimate metadata (biographical flag, retrieval depth, style, expansion count)</li>
 *   <li>Run the pre-filter chain; a firing rule settles the verdict</li>
 *   <li>Otherwise score both signal families and walk the hybrid decision ladder</li>
 * </ol>
 *
 * <p>Pure and lock-free: every collaborator is immutable after construction, so one instance serves
 * any number of request threads. Never throws for any input.</p>
 */
@Service
public class QueryClassifier {

    private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);

    private final PatternGroupTable table;
    private final PreFilterChain preFilters;
    private final HybridDecisionLadder ladder;
    private final BiographicalDetector biographicalDetector;
    private final ComplexityDepthEstimator complexityEstimator = new ComplexityDepthEstimator();
    private final QueryStyleClassifier styleClassifier = new QueryStyleClassifier();
    private final ExpansionCountEstimator expansionEstimator = new ExpansionCountEstimator();

    public QueryClassifier(PatternGroupTable table, PreFilterChain preFilters, HybridDecisionLadder ladder,
            BiographicalDetector biographicalDetector) {
        this.table = table;
        this.preFilters = preFilters;
        this.ladder = ladder;
        this.biographicalDetector = biographicalDetector;
    }

    /**
     * Classifier over the built-in pattern table, glossary and thresholds.
     */
    public static QueryClassifier withDefaults() {
        BiographicalDetector biographical = new BiographicalDetector();
        return new QueryClassifier(PatternGroupTable.defaults(), PreFilterChain.defaults(biographical),
                HybridDecisionLadder.defaults(), biographical);
    }

    @PostConstruct
    public void init() {
        log.info("QueryClassifier initialized (statisticalGroups={}, contextualGroups={}, preFilters={})",
                this.table.getStatisticalGroups().size(), this.table.getContextualGroups().size(),
                this.preFilters.getRules().size());
    }

    /**
     * Classifies one question. Null, blank and pattern-free input resolve to {@link QueryType#CONTEXTUAL}.
     *
     * <p>No length limit is applied here. Several groups pair two keyword lists across {@code .*}
     * ("who ... most"), so a question repeating both lists thousands of times takes super-linear time.
     * Callers bound input size before routing.</p>
     */
    public ClassificationResult classify(String query) {
        QueryText text = QueryText.of(query);

        boolean biographical = this.biographicalDetector.isBiographical(text);
        int depth = this.complexityEstimator.estimate(text);
        QueryStyleCategory style = this.styleClassifier.classify(text);
        int expansions = this.expansionEstimator.estimate(text, style);

        Optional<PreFilterRule> preFilter = this.preFilters.evaluate(text);
        if (preFilter.isPresent()) {
            PreFilterRule rule = preFilter.get();
            log.info("Routing: {} via pre-filter '{}' for query {}",
                    rule.verdict(), rule.name(), LogSanitizer.querySummary(query));
            return new ClassificationResult(rule.verdict(), biographical, depth, style, expansions);
        }

        FamilyScores scores = this.score(text.normalized());
        SignalScore statistical = scores.statistical();
        SignalScore contextual = scores.contextual();
        HybridDecisionLadder.Decision decision = this.ladder.decide(text.normalized(), statistical, contextual);

        if (log.isInfoEnabled()) {
            log.info("Routing: {} via {} (stat: {} {}, ctx: {} {}) for query {}",
                    decision.queryType(), decision.tier(),
                    String.format("%.1f", statistical.total()), statistical.matchedGroups(),
                    String.format("%.1f", contextual.total()), contextual.matchedGroups(),
                    LogSanitizer.querySummary(query));
        }
        return new ClassificationResult(decision.queryType(), biographical, depth, style, expansions);
    }

    /**
     * Both family scores for a question, without the pre-filter chain. Useful for tuning the table.
     */
    public FamilyScores explainScores(String query) {
        return this.score(QueryText.of(query).normalized());
    }

    private FamilyScores score(String normalized) {
        return new FamilyScores(
                WeightedScorer.score(normalized, this.table.getStatisticalGroups()),
                WeightedScorer.score(normalized, this.table.getContextualGroups()));
    }

    public record FamilyScores(SignalScore statistical, SignalScore contextual) {
    }
}
