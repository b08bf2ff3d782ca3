package com.courtvision.rag.routing.metadata;

import com.courtvision.rag.routing.QueryStyleCategory;
import com.courtvision.rag.routing.QueryText;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class QueryStyleClassifierTest {

    private final QueryStyleClassifier classifier = new QueryStyleClassifier();

    private QueryStyleCategory classify(String query) {
        return classifier.classify(QueryText.of(query));
    }

    @Nested
    @DisplayName("NOISY")
    class Noisy {

        @ParameterizedTest
        @ValueSource(strings = {
                "yo who got the most pts",
                "whos the best scorer",
                "Who is the best???",
                "What's the weather like in Boston?",
                "'; drop table players",
                "LeBron",
                "points points points leaders"})
        @DisplayName("Slang, typos, punctuation runs, off-topic, injection, lone words and stuffing are noisy")
        void noisy(String query) {
            assertEquals(QueryStyleCategory.NOISY, classify(query));
        }

        @Test
        @DisplayName("Typo markers need word boundaries")
        void typoBoundaries() {
            assertEquals(QueryStyleCategory.SIMPLE, classify("What was significant about the 2016 Finals comeback"));
        }

        @Test
        @DisplayName("A lone greeting word is not noise")
        void loneGreeting() {
            assertNotEquals(QueryStyleCategory.NOISY, classify("hello"));
        }
    }

    @Nested
    @DisplayName("COMPLEX")
    class Complex {

        @Test
        @DisplayName("Synthesis vocabulary is complex")
        void synthesis() {
            assertEquals(QueryStyleCategory.COMPLEX, classify("Analyze the evolution of three-point shooting"));
        }

        @Test
        @DisplayName("Multi-part request beats a pronoun")
        void multipartBeatsPronoun() {
            assertEquals(QueryStyleCategory.COMPLEX, classify("Compare their stats and explain why"));
        }

        @Test
        @DisplayName("Long questions are complex")
        void longQuestion() {
            assertEquals(QueryStyleCategory.COMPLEX,
                    classify("Which guards averaged more than twenty points per game while also leading their team in assists during the season"));
        }
    }

    @Nested
    @DisplayName("CONVERSATIONAL")
    class Conversational {

        @Test
        @DisplayName("Pronoun reference is conversational")
        void pronoun() {
            assertEquals(QueryStyleCategory.CONVERSATIONAL, classify("What about his assists?"));
        }

        @Test
        @DisplayName("Follow-up phrase is conversational")
        void followUp() {
            assertEquals(QueryStyleCategory.CONVERSATIONAL, classify("Tell me more"));
        }

        @Test
        @DisplayName("Empty query is conversational")
        void empty() {
            assertEquals(QueryStyleCategory.CONVERSATIONAL, classify(""));
        }
    }

    @Test
    @DisplayName("Clear single-topic question is simple")
    void simple() {
        assertEquals(QueryStyleCategory.SIMPLE, classify("Who are the top 5 scorers this season?"));
    }

    @Test
    @DisplayName("Counts non-overlapping occurrences")
    void occurrences() {
        assertEquals(2, QueryStyleClassifier.occurrences("a and b and c", " and "));
        assertEquals(0, QueryStyleClassifier.occurrences("abc", ","));
    }
}
