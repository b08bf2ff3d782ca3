package com.courtvision.constant;

import java.util.List;

/**
 * Regex fragments and term lists shared by the routing patterns.
 *
 * <p>Fragments are bare alternations (no surrounding group) so callers can wrap them
 * with whatever boundary handling the surrounding pattern needs.</p>
 */
public final class BasketballVocabulary {

    /** Box-score column abbreviations, including per-game and informal shorthands. */
    public static final String STAT_ABBREVIATIONS =
            "pts|reb|ast|stl|blk|tov|pf|gp|fgm|fga|ftm|fta"
            + "|3pm|3pa|oreb|dreb"
            + "|fp|dd2|td3|pie|pace|poss"
            + "|ppg|rpg|apg|spg|bpg|mpg"
            + "|avg|pct";

    /** Percentage abbreviations. '%' is not a word character, so these are matched without a trailing \b. */
    public static final String PERCENT_ABBREVIATIONS = "fg%|ft%|3p%|efg%|ts%|usg%|oreb%|dreb%|reb%|ast%";

    public static final String ADVANCED_ABBREVIATIONS = "offrtg|defrtg|netrtg|ast/to|to\\s*ratio|ast\\s*ratio";

    /** Natural-language equivalents of the stat columns. */
    public static final String STAT_WORDS =
            "points|rebounds|assists|steals|blocks|turnovers|fouls"
            + "|wins|losses|games\\s*played|minutes"
            + "|free\\s*throws?|field\\s*goals?|three.pointers?"
            + "|double.doubles?|triple.doubles?"
            + "|possessions?|personal\\s+fouls?"
            + "|stats|statistics|averages?|numbers"
            + "|attempts?|makes?|percentage|pct|efficiency"
            + "|record|season|roster"
            + "|mvp|all.star|all.nba|rookie|veteran|starter|bench"
            + "|scorer|rebounder|passer|shooter|blocker|playmaker";

    /** Full names from the stats data dictionary. */
    public static final String DICTIONARY_NAMES =
            "plus.minus|fantasy\\s+points"
            + "|3.point\\s+(percentage|shots?\\s*(attempted|made))"
            + "|assist.to.turnover\\s+ratio|assist\\s+percentage|assist\\s+ratio"
            + "|defensive\\s+rebounds?|defensive\\s+rebound\\s*%"
            + "|offensive\\s+rebounds?|offensive\\s+rebound\\s*%"
            + "|total\\s+rebounds?|total\\s+rebound\\s*%"
            + "|field\\s+goal\\s+(percentage|attempted|made)"
            + "|free\\s+throw\\s+(percentage|attempted|made)"
            + "|effective\\s+field\\s+goal\\s*%?"
            + "|true\\s+shooting\\s*%?"
            + "|games\\s+played|minutes\\s+per\\s+game";

    public static final String ADVANCED_WORDS =
            "offensive\\s+rating|defensive\\s+rating|net\\s+rating"
            + "|usage\\s+rate|player\\s+impact(\\s+estimate)?"
            + "|assist\\s+ratio|turnover\\s+ratio"
            + "|rebound\\s+percentage|assist\\s+percentage";

    /** Column descriptions as they appear in the stats database schema. */
    public static final String COLUMN_DESCRIPTIONS =
            "games\\s+played|minutes\\s+per\\s+game"
            + "|field\\s+goals?\\s+made|field\\s+goals?\\s+attempted|field\\s+goal\\s+percentage"
            + "|3.point\\s+shots?\\s+made|3.point\\s+shots?\\s+attempted|3.point\\s+percentage"
            + "|free\\s+throws?\\s+made|free\\s+throws?\\s+attempted|free\\s+throw\\s+percentage"
            + "|offensive\\s+rebounds?|defensive\\s+rebounds?|total\\s+rebounds?"
            + "|offensive\\s+rating|defensive\\s+rating|net\\s+rating"
            + "|assist\\s+percentage|assist.to.turnover\\s+ratio|assist\\s+ratio"
            + "|offensive\\s+rebound\\s*%|defensive\\s+rebound\\s*%|total\\s+rebound\\s*%"
            + "|effective\\s+field\\s+goal\\s*%?|true\\s+shooting\\s*%?"
            + "|usage\\s+rate|player\\s+impact\\s+estimate"
            + "|fantasy\\s+points?|double.doubles?|triple.doubles?|plus.minus"
            + "|turnover\\s+ratio|rebound\\s+percentage|possessions?";

    public static final String TEAM_NAMES =
            "lakers?|celtics?|warriors?|nets?|knicks?|bulls?|heat|suns?|nuggets?|bucks?|76ers|sixers"
            + "|cavaliers?|cavs|hawks?|rockets?|clippers?|mavericks?|mavs|grizzlies|thunder|pelicans?"
            + "|kings?|pistons?|hornets?|wizards?|pacers?|raptors?|blazers?|spurs?|wolves|timberwolves"
            + "|magic|jazz";

    /** Player and franchise names that mark a "who is / tell me about" query as biographical. */
    public static final String BIOGRAPHICAL_NAMES =
            "lebron|jordan|kobe|curry|james|durant|harden|jokic|jokić|embiid|luka|doncic|dončić"
            + "|giannis|wembanyama|tatum|chamberlain|wilt"
            + "|lakers|celtics|heat|warriors|mavericks|bulls|cavaliers";

    /** Reference terms that a reader looks up rather than queries data for. */
    public static final List<String> GLOSSARY_TERMS = List.of(
            "triple-double", "double-double", "triple double", "double double",
            "first option", "second option", "third option",
            "iso", "isolation", "pick and roll", "pick-and-roll", "pnr",
            "zone defense", "man-to-man defense", "man to man",
            "variance", "true shooting", "effective field goal",
            "player impact estimate", "plus-minus");

    private BasketballVocabulary() {
    }
}
