package com.courtvision.rag.routing;

import com.courtvision.config.RoutingProperties;
import java.util.regex.Pattern;

/**
 * Turns the two family scores into a verdict.
 *
 * <p>Tiers, first satisfied wins:</p>
 * <ol>
 *   <li>Connector: a structural bridge ("and explain", "but why", "- how") with both families present</li>
 *   <li>Ratio: both scores at least {@code ratioFloor} and neither dominating past {@code ratioThreshold}</li>
 *   <li>Auto-promote: a very strong statistical signal alongside a non-trivial contextual one</li>
 *   <li>Winner-take-all, ties (including 0/0) going to {@link QueryType#CONTEXTUAL}</li>
 * </ol>
 */
public class HybridDecisionLadder {

    public enum Tier {
        CONNECTOR,
        RATIO,
        AUTO_PROMOTE,
        WINNER_TAKE_ALL,
        TIE_DEFAULT
    }

    public record Decision(QueryType queryType, Tier tier) {
    }

    // Dashes arrive normalized to " - "
    private static final Pattern CONNECTOR = Pattern.compile(
            "\\b(and\\s+explain|and\\s+why|and\\s+what\\s+makes|then\\s+explain|but\\s+why|and\\s+how)\\b"
            + "|(?:\\s+-\\s+|\\s*\\u2014\\s*|\\s*\\u2013\\s*)(explain|why|how|what\\s+makes)",
            PatternGroup.FLAGS);

    private final double ratioFloor;
    private final double ratioThreshold;
    private final double autoPromoteStatistical;
    private final double autoPromoteContextual;

    public HybridDecisionLadder(double ratioFloor, double ratioThreshold,
            double autoPromoteStatistical, double autoPromoteContextual) {
        this.ratioFloor = ratioFloor;
        this.ratioThreshold = ratioThreshold;
        this.autoPromoteStatistical = autoPromoteStatistical;
        this.autoPromoteContextual = autoPromoteContextual;
    }

    public static HybridDecisionLadder from(RoutingProperties properties) {
        properties.validate();
        return new HybridDecisionLadder(properties.getRatioFloor(), properties.getRatioThreshold(),
                properties.getAutoPromoteStatistical(), properties.getAutoPromoteContextual());
    }

    public static HybridDecisionLadder defaults() {
        return from(new RoutingProperties());
    }

    public Decision decide(String normalizedQuery, SignalScore statistical, SignalScore contextual) {
        double stat = statistical.total();
        double ctx = contextual.total();

        if (stat > 0.0 && ctx > 0.0 && hasConnector(normalizedQuery)) {
            return new Decision(QueryType.HYBRID, Tier.CONNECTOR);
        }
        if (stat >= this.ratioFloor && ctx >= this.ratioFloor
                && Math.min(stat, ctx) / Math.max(stat, ctx) >= this.ratioThreshold) {
            return new Decision(QueryType.HYBRID, Tier.RATIO);
        }
        if (stat >= this.autoPromoteStatistical && ctx >= this.autoPromoteContextual) {
            return new Decision(QueryType.HYBRID, Tier.AUTO_PROMOTE);
        }
        if (stat > ctx) {
            return new Decision(QueryType.STATISTICAL, Tier.WINNER_TAKE_ALL);
        }
        if (ctx > stat) {
            return new Decision(QueryType.CONTEXTUAL, Tier.WINNER_TAKE_ALL);
        }
        return new Decision(QueryType.CONTEXTUAL, Tier.TIE_DEFAULT);
    }

    public boolean hasConnector(String normalizedQuery) {
        return CONNECTOR.matcher(normalizedQuery).find();
    }
}
