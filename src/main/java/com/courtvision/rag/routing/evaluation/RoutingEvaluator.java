package com.courtvision.rag.routing.evaluation;

import com.courtvision.rag.routing.QueryClassifier;
import com.courtvision.rag.routing.QueryType;
import com.courtvision.util.LogSanitizer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Replays labelled questions through the classifier and tallies how many land on their expected route.
 */
@Component
public class RoutingEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RoutingEvaluator.class);

    public static final String BUNDLED_CORPUS = "routing/labelled-queries.json";

    private static final TypeReference<List<LabelledQuery>> CORPUS_TYPE = new TypeReference<>() {
    };

    private final QueryClassifier classifier;
    private final ObjectMapper objectMapper;

    public RoutingEvaluator(QueryClassifier classifier, ObjectMapper objectMapper) {
        this.classifier = classifier;
        this.objectMapper = objectMapper;
    }

    public List<LabelledQuery> load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            List<LabelledQuery> cases = this.objectMapper.readValue(in, CORPUS_TYPE);
            log.info("Loaded {} labelled routing cases from {}", cases.size(), resource.getDescription());
            return cases;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read labelled routing corpus " + resource.getDescription(), e);
        }
    }

    public RoutingEvaluationReport evaluateBundled() {
        return this.evaluate(this.load(new ClassPathResource(BUNDLED_CORPUS)));
    }

    public RoutingEvaluationReport evaluate(List<LabelledQuery> cases) {
        Map<QueryType, Map<QueryType, Integer>> confusion = new EnumMap<>(QueryType.class);
        List<RoutingEvaluationReport.Misroute> misrouted = new ArrayList<>();
        int correct = 0;
        for (LabelledQuery labelled : cases) {
            QueryType expected = labelled.expectedType();
            QueryType actual = this.classifier.classify(labelled.query()).queryType();
            confusion.computeIfAbsent(expected, k -> new EnumMap<>(QueryType.class)).merge(actual, 1, Integer::sum);
            if (expected == actual) {
                correct++;
            } else {
                QueryClassifier.FamilyScores scores = this.classifier.explainScores(labelled.query());
                misrouted.add(new RoutingEvaluationReport.Misroute(labelled.query(), expected, actual, scores));
                log.debug("Misrouted {}: expected {}, got {} (stat: {}, ctx: {})",
                        LogSanitizer.querySummary(labelled.query()), expected, actual,
                        scores.statistical().matchedGroups(), scores.contextual().matchedGroups());
            }
        }
        RoutingEvaluationReport report = new RoutingEvaluationReport(cases.size(), correct, confusion, misrouted);
        log.info("Routing evaluation: {}/{} correct ({})",
                correct, cases.size(), String.format("%.1f%%", report.accuracy() * 100.0));
        return report;
    }
}
