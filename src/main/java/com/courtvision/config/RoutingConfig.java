package com.courtvision.config;

import com.courtvision.constant.BasketballVocabulary;
import com.courtvision.rag.routing.BiographicalDetector;
import com.courtvision.rag.routing.HybridDecisionLadder;
import com.courtvision.rag.routing.PatternGroupTable;
import com.courtvision.rag.routing.PreFilterChain;
import com.courtvision.rag.routing.QueryType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the routing tables. Bad thresholds or a broken pattern table fail the context on startup.
 */
@Configuration
public class RoutingConfig {

    @Bean
    public PatternGroupTable patternGroupTable() {
        return PatternGroupTable.defaults();
    }

    @Bean
    public BiographicalDetector biographicalDetector() {
        return new BiographicalDetector();
    }

    @Bean
    public PreFilterChain preFilterChain(BiographicalDetector biographicalDetector, RoutingProperties properties) {
        List<String> glossary = new ArrayList<>(BasketballVocabulary.GLOSSARY_TERMS);
        if (properties.getExtraGlossaryTerms() != null) {
            glossary.addAll(properties.getExtraGlossaryTerms());
        }
        return new PreFilterChain(biographicalDetector, glossary);
    }

    @Bean
    public HybridDecisionLadder hybridDecisionLadder(RoutingProperties properties) {
        return HybridDecisionLadder.from(properties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "courtvision.routing.llm-fallback", name = "enabled", havingValue = "true")
    public Cache<String, QueryType> routingFallbackCache(RoutingProperties properties) {
        properties.validate();
        return Caffeine.newBuilder()
            .maximumSize(properties.getLlmFallback().getCacheMaxSize())
            .expireAfterWrite(Duration.ofSeconds(properties.getLlmFallback().getCacheTtlSeconds()))
            .build();
    }
}
