package com.courtvision.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "courtvision.routing")
public class RoutingProperties {
    /**
     * Minimum score both families need before the ratio tier can call a question hybrid.
     */
    private double ratioFloor = 1.5;

    /**
     * Smaller-to-larger score ratio at which two present families count as balanced.
     */
    private double ratioThreshold = 0.4;

    /**
     * Statistical score that promotes to hybrid when paired with {@link #autoPromoteContextual}.
     */
    private double autoPromoteStatistical = 4.0;

    private double autoPromoteContextual = 2.0;

    /**
     * Deployment-specific glossary terms, added to the built-in basketball glossary.
     *
     * Example:
     * courtvision.routing.extra-glossary-terms[0]=load management
     */
    private List<String> extraGlossaryTerms = new ArrayList<>();

    private LlmFallback llmFallback = new LlmFallback();

    public double getRatioFloor() {
        return ratioFloor;
    }

    public void setRatioFloor(double ratioFloor) {
        this.ratioFloor = ratioFloor;
    }

    public double getRatioThreshold() {
        return ratioThreshold;
    }

    public void setRatioThreshold(double ratioThreshold) {
        this.ratioThreshold = ratioThreshold;
    }

    public double getAutoPromoteStatistical() {
        return autoPromoteStatistical;
    }

    public void setAutoPromoteStatistical(double autoPromoteStatistical) {
        this.autoPromoteStatistical = autoPromoteStatistical;
    }

    public double getAutoPromoteContextual() {
        return autoPromoteContextual;
    }

    public void setAutoPromoteContextual(double autoPromoteContextual) {
        this.autoPromoteContextual = autoPromoteContextual;
    }

    public List<String> getExtraGlossaryTerms() {
        return extraGlossaryTerms;
    }

    public void setExtraGlossaryTerms(List<String> extraGlossaryTerms) {
        this.extraGlossaryTerms = extraGlossaryTerms;
    }

    public LlmFallback getLlmFallback() {
        return llmFallback;
    }

    public void setLlmFallback(LlmFallback llmFallback) {
        this.llmFallback = llmFallback;
    }

    /**
     * Rejects threshold combinations the decision ladder cannot honour.
     *
     * @throws IllegalStateException naming the offending property
     */
    public void validate() {
        if (!(ratioFloor > 0.0)) {
            throw new IllegalStateException("courtvision.routing.ratio-floor must be positive, was " + ratioFloor);
        }
        if (!(ratioThreshold > 0.0 && ratioThreshold <= 1.0)) {
            throw new IllegalStateException(
                    "courtvision.routing.ratio-threshold must be in (0, 1], was " + ratioThreshold);
        }
        if (!(autoPromoteStatistical > 0.0)) {
            throw new IllegalStateException(
                    "courtvision.routing.auto-promote-statistical must be positive, was " + autoPromoteStatistical);
        }
        if (!(autoPromoteContextual > 0.0)) {
            throw new IllegalStateException(
                    "courtvision.routing.auto-promote-contextual must be positive, was " + autoPromoteContextual);
        }
        if (llmFallback.getCacheMaxSize() < 0) {
            throw new IllegalStateException(
                    "courtvision.routing.llm-fallback.cache-max-size must not be negative, was "
                            + llmFallback.getCacheMaxSize());
        }
        if (llmFallback.getCacheTtlSeconds() <= 0) {
            throw new IllegalStateException(
                    "courtvision.routing.llm-fallback.cache-ttl-seconds must be positive, was "
                            + llmFallback.getCacheTtlSeconds());
        }
    }

    public static class LlmFallback {
        /**
         * Routes every question through the language model instead of the heuristic verdict.
         * Metadata still comes from the heuristic classifier.
         */
        private boolean enabled = false;

        private long cacheMaxSize = 500;

        private long cacheTtlSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getCacheMaxSize() {
            return cacheMaxSize;
        }

        public void setCacheMaxSize(long cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
        }

        public long getCacheTtlSeconds() {
            return cacheTtlSeconds;
        }

        public void setCacheTtlSeconds(long cacheTtlSeconds) {
            this.cacheTtlSeconds = cacheTtlSeconds;
        }
    }
}
