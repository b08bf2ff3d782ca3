package com.courtvision.rag.routing;

import static com.courtvision.constant.BasketballVocabulary.ADVANCED_ABBREVIATIONS;
import static com.courtvision.constant.BasketballVocabulary.ADVANCED_WORDS;
import static com.courtvision.constant.BasketballVocabulary.COLUMN_DESCRIPTIONS;
import static com.courtvision.constant.BasketballVocabulary.DICTIONARY_NAMES;
import static com.courtvision.constant.BasketballVocabulary.PERCENT_ABBREVIATIONS;
import static com.courtvision.constant.BasketballVocabulary.STAT_ABBREVIATIONS;
import static com.courtvision.constant.BasketballVocabulary.STAT_WORDS;
import static com.courtvision.constant.BasketballVocabulary.TEAM_NAMES;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable registry of the weighted pattern groups for both signal families.
 *
 * <p>Built once at startup and shared read-only by every classification. Construction validates that
 * group names are unique across both families, so a misconfigured table fails the application context
 * instead of a request.</p>
 */
public final class PatternGroupTable {

    private final List<PatternGroup> statisticalGroups;
    private final List<PatternGroup> contextualGroups;

    public PatternGroupTable(List<PatternGroup> statisticalGroups, List<PatternGroup> contextualGroups) {
        this.statisticalGroups = List.copyOf(statisticalGroups);
        this.contextualGroups = List.copyOf(contextualGroups);
        Set<String> names = new HashSet<>();
        for (PatternGroup group : this.statisticalGroups) {
            requireUnique(names, group);
        }
        for (PatternGroup group : this.contextualGroups) {
            requireUnique(names, group);
        }
    }

    public List<PatternGroup> getStatisticalGroups() {
        return this.statisticalGroups;
    }

    public List<PatternGroup> getContextualGroups() {
        return this.contextualGroups;
    }

    public int size() {
        return this.statisticalGroups.size() + this.contextualGroups.size();
    }

    private static void requireUnique(Set<String> names, PatternGroup group) {
        if (!names.add(group.name())) {
            throw new PatternTableException(group.name(), "duplicate group name");
        }
    }

    /**
     * The production table: 13 statistical groups and 10 contextual groups.
     */
    public static PatternGroupTable defaults() {
        return new PatternGroupTable(statisticalDefaults(), contextualDefaults());
    }

    static List<PatternGroup> statisticalDefaults() {
        return List.of(
                PatternGroup.compile("S1_db_abbreviations", 3.0,
                        "\\b(" + STAT_ABBREVIATIONS + ")\\b"
                        + "|(?<!\\w)(" + PERCENT_ABBREVIATIONS + ")"
                        + "|\\b(" + ADVANCED_ABBREVIATIONS + ")\\b"),
                PatternGroup.compile("S2_full_stat_words_and_db_descriptions", 3.0,
                        "\\b(" + STAT_WORDS + ")\\b"
                        + "|(" + DICTIONARY_NAMES + ")"
                        + "|(" + ADVANCED_WORDS + ")"
                        + "|(" + COLUMN_DESCRIPTIONS + ")"),
                PatternGroup.compile("S3_superlatives_numbers", 2.0,
                        "\\b(top|bottom)\\s+\\d+"
                        + "|\\b(most|fewest|highest|lowest|best|worst|leading|leader)\\s+\\d+"
                        + "|\\b(who|which)\\b.*\\b(most|fewest|highest|lowest|best|worst)\\b"),
                PatternGroup.compile("S4_aggregations", 2.0,
                        "\\b(average|mean|total|sum|count|how many|maximum|minimum|median)\\b"
                        + "|\\bwhat\\s+(is|are)\\b.*\\b(percentage|average|total|rating|ratio)\\b"
                        + "|\\bwhat\\s+percentage\\b|\\bper\\s+game\\b"),
                PatternGroup.compile("S5_numeric_comparisons", 1.5,
                        "\\b(better|worse|higher|lower|greater|fewer|more|less)\\s+than\\s+\\d+"
                        + "|\\b(over|under|above|below|exceeds?|at\\s+least|at\\s+most)\\s+\\d+"
                        + "|\\bcompare\\b"
                        + "|\\b(who has more|who has fewer|who has less|which player has more|who recorded more)\\b"
                        + "|\\b(more than|less than|fewer than|over|under|above|below)\\b\\s*\\d+"
                        + "|\\b(with|having)\\b.*\\d+\\+?\\s*(points|rebounds|assists|games|wins|steals|blocks)"
                        + "|\\d+\\+?\\s*(points|rebounds|assists|steals|blocks|wins|games|percent)"),
                PatternGroup.compile("S6_player_team_stat_queries", 1.5,
                        "\\b(who\\s+is|who.?s|which)\\b.*\\b(best|better|worst|worse)\\b.*\\b(scorer|rebounder|passer|defender|shooter|blocker|player)\\b"
                        + "|\\b(best|better|worst|worse)\\b.*\\b(at|in|for)\\b.*\\b(scoring|rebounding|assists|defense|shooting|blocking|stealing)\\b"
                        + "|\\b(who has|which player has)\\b.*\\b(best|worst|highest|lowest|top|better)\\b.*\\b(percentage|pct|efficiency|rating)\\b"
                        + "|\\b(show|list|find|get)\\b.*\\b(assist|rebound|point|steal|block|score|stat).*(leader|top|best|worst)\\b"
                        + "|\\b(show|list|find|get)\\b.*(the)?\\s*(top|bottom|best|worst|leading|leader)"
                        + "|\\b(show|list|find|get)\\b.*\\b(me\\s+)?\\b(stats|statistics|averages?|numbers)\\b"
                        + "|\\b(who\\s+is|who.?s)\\b.*\\b(leading|top|number one|#1|the\\s+best|the\\s+worst|the\\s+mvp)\\b"
                        + "|\\b(tell me about|gimme|give me)\\b.*\\b(stats|statistics|numbers|leaders?|scoring|averages?)\\b"
                        + "|\\b(leaders?|leader)\\b"),
                PatternGroup.compile("S7_team_names", 1.0,
                        "\\b(list|show|find|get)\\b.*\\b(all\\s+)?\\bplayers?\\b"
                        + "|\\bplays?\\s+(for|on)\\b"
                        + "|\\b(" + TEAM_NAMES + ")\\b"),
                PatternGroup.compile("S8_stat_verbs_numbers", 1.0,
                        "\\b(scored|averaging|shooting|recording|ranked|ranking)\\b.*\\d+"
                        + "|\\b(ranks|ranking|ranked)\\b.*\\b(by|in)\\b"
                        + "|\\b(scored|averaging|scoring|recording)\\b"),
                PatternGroup.compile("S9_possessive_stats", 1.5,
                        "\\bwhat is\\b.*'s?\\s+\\b(\\d-point|three.point|free.throw|field.goal|scoring|shooting|rebound|assist|block|steal)"
                        + "|\\b(his|her|their|its)\\s+(assists?|rebounds?|points?|steals?|blocks?|stats?|scoring|shooting|games?|wins?|losses?|minutes?|turnovers?|fouls?|rating|efficiency|percentage)\\b"
                        + "|\\w+'s\\s+(stats|points|rebounds|assists|steals|blocks|shooting|scoring|efficiency|averages?|numbers|percentage|pct|record)\\b"),
                PatternGroup.compile("S10_3point_references", 1.0,
                        "\\bfrom\\s+3\\b|\\bfrom\\s+three\\b|\\bfrom\\s+downtown\\b"
                        + "|\\b(shoots?|shooting)\\b.*\\b(better|worse|best|worst|from\\s+\\d|from\\s+three)\\b"
                        + "|\\b3\\s*-?\\s*pt\\b"),
                PatternGroup.compile("S11_filter_find", 1.5,
                        "\\b(find|which|who are)\\b.*\\b(players?|teams?)\\b.*\\b(with|having|that)\\b"
                        + "|\\b(who are|list|show me)\\b.*\\b(top|bottom|players with|scorers|leaders)\\b"
                        + "|\\bhow many\\b"),
                PatternGroup.compile("S12_efficiency_roles", 1.0,
                        "\\b(efficient|effective|productive)\\s+(goal\\s*maker|scorer|shooter|rebounder|passer|blocker|playmaker|player)\\b"
                        + "|\\b(who\\s+is|who.?s)\\b.*\\b(more|most|less|least)\\b.*\\b(efficient|effective|productive)\\b"),
                PatternGroup.compile("S13_slang_stats", 0.5,
                        "\\b(whats?|wuts|wat)\\b.*\\b(avg|average|stats?|pct|record|points?|assists?|rebounds?)\\b"
                        + "|\\bda\\s+(league|nba)\\b"
                        + "|\\b(plz|pls|lol|yo|bruh|bro|fam)\\b.*\\b(stats?|points?|assists?|rebounds?|avg|pct|score|scorer|top\\s+\\d|record)\\b"
                        + "|\\b(stats?|points?|assists?|rebounds?|avg|pct|score|scorer|top\\s+\\d|record)\\b.*\\b(plz|pls|lol|yo|bruh|bro|fam)\\b"));
    }

    static List<PatternGroup> contextualDefaults() {
        return List.of(
                // "how many", "how much" and "how ... compare" ask for numbers, not explanations
                PatternGroup.compile("C1_why_how_questions", 3.0,
                        "\\b(why|explain|what makes|what caused)\\b"
                        + "|\\bhow\\b(?!.*\\b(many|much)\\b)(?!.*\\bcompare\\b)"),
                PatternGroup.compile("C2_opinion_discussion", 2.5,
                        "\\b(think|believe|opinion|discussion|debate|argue)\\b"
                        + "|\\b(reddit|fans|people|community)\\b.*\\b(think|say|discuss)\\b"
                        + "|\\b(fans?|community|reddit|people)\\b.*\\b(about|love|hate|view|feel|consider|debate|say)\\b"
                        + "|\\b(according\\s+to|what\\s+do)\\b.*\\b(fans?|reddit|people|community)\\b"
                        + "|\\b(popular|discussed|controversial|trending)\\s+(opinions?|topics?|debates?|discussions?)\\b"),
                PatternGroup.compile("C3_subjective_qualifiers", 2.0,
                        "\\b(underrated|overrated|surprising|disappointing|impressive|controversial|valuable|worth)\\b"),
                PatternGroup.compile("C4_strategy_style", 2.0,
                        "\\b(strategy|style|approach|technique|tactics)\\b"),
                PatternGroup.compile("C5_historical_context", 1.5,
                        "\\b(history|evolution|changed|transformation)\\b"),
                // "better than 20" is a threshold and "better ... stats" is a stat comparison
                PatternGroup.compile("C6_qualitative_assessments", 2.0,
                        "\\b(greatest|goat|best ever|all.time)\\b(?!.*\\bstats\\b)"
                        + "|\\b(better|worse)\\b(?!.*\\bstats\\b)(?!.*\\bthan\\s+\\d)(?!.*\\bcompare\\b)"
                        + "(?!.*\\b(from\\s+3|from\\s+three|shooting|scorer|scoring|field\\s+goal|free\\s+throw)\\b)"),
                PatternGroup.compile("C7_impact_influence", 2.0,
                        "\\b(impact|influence|effect|significance)\\b"),
                PatternGroup.compile("C8_analysis_interpretation", 1.5,
                        "\\b(analy[sz]e|analysis|interpret|understand|insight|correlation)\\b"),
                PatternGroup.compile("C9_opinion_verbs", 1.0,
                        "\\b(view|feel|consider|regard|perceive|expected?|surprising?|chances?|hopes?)\\b"),
                PatternGroup.compile("C10_quoted_reference", 1.0,
                        "\\b(quote|direct\\s+quote|excerpt|what\\s+did\\s+\\w+\\s+say)\\b"));
    }
}
