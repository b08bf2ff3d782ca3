package com.courtvision.rag.routing;

import com.courtvision.constant.BasketballVocabulary;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ordered semantic checks that settle the verdict before weighted scoring.
 *
 * <p>Evaluation order is fixed: opinion/quality, biographical, debate/discussion, definitional,
 * glossary term. The first rule that applies wins.</p>
 */
public class PreFilterChain {

    public static final String OPINION_QUALITY = "opinion-quality";
    public static final String BIOGRAPHICAL = "biographical";
    public static final String DEBATE_DISCUSSION = "debate-discussion";
    public static final String DEFINITIONAL = "definitional";
    public static final String GLOSSARY_TERM = "glossary-term";

    private final Pattern glossaryPattern;
    private final List<PreFilterRule> rules;

    public PreFilterChain(BiographicalDetector biographicalDetector, Collection<String> glossaryTerms) {
        this.glossaryPattern = compileGlossary(glossaryTerms);
        this.rules = List.of(
                new PreFilterRule(OPINION_QUALITY, SemanticPatterns::isOpinionQuality, QueryType.CONTEXTUAL),
                new PreFilterRule(BIOGRAPHICAL, biographicalDetector::isBiographical, QueryType.HYBRID),
                new PreFilterRule(DEBATE_DISCUSSION, SemanticPatterns::isDebateDiscussion, QueryType.HYBRID),
                new PreFilterRule(DEFINITIONAL, SemanticPatterns::isDefinitional, QueryType.CONTEXTUAL),
                // a glossary term used to ask for data ("highest true shooting") is left to scoring
                new PreFilterRule(GLOSSARY_TERM,
                        query -> this.hasGlossaryTerm(query) && !SemanticPatterns.hasStatisticalIntent(query),
                        QueryType.CONTEXTUAL));
    }

    /**
     * Chain over the built-in glossary only.
     */
    public static PreFilterChain defaults(BiographicalDetector biographicalDetector) {
        return new PreFilterChain(biographicalDetector, BasketballVocabulary.GLOSSARY_TERMS);
    }

    public Optional<PreFilterRule> evaluate(QueryText query) {
        for (PreFilterRule rule : this.rules) {
            if (rule.applies(query)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public List<PreFilterRule> getRules() {
        return this.rules;
    }

    public boolean hasGlossaryTerm(QueryText query) {
        return this.glossaryPattern != null && this.glossaryPattern.matcher(query.normalized()).find();
    }

    private static Pattern compileGlossary(Collection<String> terms) {
        Set<String> cleaned = new LinkedHashSet<>();
        for (String term : terms) {
            if (term != null && !term.isBlank()) {
                cleaned.add(term.trim().toLowerCase(Locale.ROOT));
            }
        }
        if (cleaned.isEmpty()) {
            return null;
        }
        // longest first so "man-to-man defense" wins over "man to man"
        String alternation = cleaned.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternation + ")\\b", PatternGroup.FLAGS);
    }
}
