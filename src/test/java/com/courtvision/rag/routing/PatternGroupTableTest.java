package com.courtvision.rag.routing;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.PatternSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PatternGroupTableTest {

    @Nested
    @DisplayName("Production table")
    class ProductionTable {

        @Test
        @DisplayName("Has 13 statistical and 10 contextual groups")
        void groupCounts() {
            PatternGroupTable table = PatternGroupTable.defaults();
            assertEquals(13, table.getStatisticalGroups().size());
            assertEquals(10, table.getContextualGroups().size());
            assertEquals(23, table.size());
        }

        @Test
        @DisplayName("Group names are unique and weights positive")
        void namesAndWeights() {
            PatternGroupTable table = PatternGroupTable.defaults();
            Set<String> names = new HashSet<>();
            for (PatternGroup group : table.getStatisticalGroups()) {
                assertTrue(names.add(group.name()));
                assertTrue(group.weight() > 0.0);
            }
            for (PatternGroup group : table.getContextualGroups()) {
                assertTrue(names.add(group.name()));
                assertTrue(group.weight() > 0.0);
            }
        }

        @Test
        @DisplayName("Strongest groups carry weight 3")
        void strongestGroups() {
            PatternGroupTable table = PatternGroupTable.defaults();
            assertEquals(3.0, table.getStatisticalGroups().get(0).weight());
            assertEquals(3.0, table.getStatisticalGroups().get(1).weight());
            assertEquals(3.0, table.getContextualGroups().get(0).weight());
        }

        @Test
        @DisplayName("Table lists are read-only")
        void readOnly() {
            PatternGroupTable table = PatternGroupTable.defaults();
            assertThrows(UnsupportedOperationException.class, () -> table.getStatisticalGroups().clear());
        }
    }

    @Nested
    @DisplayName("Fail-fast construction")
    class FailFast {

        @Test
        @DisplayName("Invalid regex is rejected with the group name")
        void invalidRegex() {
            PatternTableException e = assertThrows(PatternTableException.class,
                    () -> PatternGroup.compile("broken", 1.0, "(unclosed"));
            assertEquals("broken", e.getGroupName());
            assertInstanceOf(PatternSyntaxException.class, e.getCause());
        }

        @Test
        @DisplayName("Non-positive weight is rejected")
        void nonPositiveWeight() {
            assertThrows(PatternTableException.class, () -> PatternGroup.compile("zero", 0.0, "x"));
            assertThrows(PatternTableException.class, () -> PatternGroup.compile("negative", -1.0, "x"));
            assertThrows(PatternTableException.class, () -> PatternGroup.compile("nan", Double.NaN, "x"));
        }

        @Test
        @DisplayName("Blank name is rejected")
        void blankName() {
            assertThrows(PatternTableException.class, () -> PatternGroup.compile(" ", 1.0, "x"));
            assertThrows(PatternTableException.class, () -> PatternGroup.compile(null, 1.0, "x"));
        }

        @Test
        @DisplayName("Duplicate names across families are rejected")
        void duplicateAcrossFamilies() {
            List<PatternGroup> stat = List.of(PatternGroup.compile("shared", 1.0, "points"));
            List<PatternGroup> ctx = List.of(PatternGroup.compile("shared", 1.0, "why"));
            PatternTableException e = assertThrows(PatternTableException.class, () -> new PatternGroupTable(stat, ctx));
            assertEquals("shared", e.getGroupName());
        }

        @Test
        @DisplayName("Table failures are IllegalStateException")
        void isIllegalState() {
            assertInstanceOf(IllegalStateException.class, new PatternTableException("g", "bad"));
        }
    }

    @Nested
    @DisplayName("Weighted scoring")
    class Scoring {

        private final List<PatternGroup> groups = List.of(
                PatternGroup.compile("points", 2.0, "\\bpoints?\\b"),
                PatternGroup.compile("rebounds", 1.5, "\\brebounds?\\b"),
                PatternGroup.compile("never", 9.0, "\\bzzz\\b"));

        @Test
        @DisplayName("Each group contributes its weight once")
        void weightOncePerGroup() {
            SignalScore score = WeightedScorer.score("points points points and rebounds", groups);
            assertEquals(3.5, score.total());
            assertEquals(List.of("points", "rebounds"), score.matchedGroups());
        }

        @Test
        @DisplayName("No match yields zero")
        void noMatch() {
            SignalScore score = WeightedScorer.score("nothing here", groups);
            assertEquals(0.0, score.total());
            assertTrue(score.matchedGroups().isEmpty());
            assertFalse(score.isPositive());
        }

        @Test
        @DisplayName("Accented names are word characters")
        void unicodeWordBoundary() {
            PatternGroup group = PatternGroup.compile("possessive", 1.0, "\\w+'s\\s+stats");
            assertTrue(group.fires("jokić's stats"));
            PatternGroup name = PatternGroup.compile("name", 1.0, "\\bjoki\\b");
            assertFalse(name.fires("jokić"));
        }
    }
}
