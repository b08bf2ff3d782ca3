package com.courtvision.rag.routing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class GreetingDetectorTest {

    private final GreetingDetector detector = new GreetingDetector();

    @ParameterizedTest
    @ValueSource(strings = {"hi", "Hello!", "  Hey there  ", "thanks", "Thank you", "good morning",
            "How are you?", "what's up?", "hello everyone", "bye"})
    @DisplayName("Pure greetings are detected")
    void pureGreetings(String query) {
        assertTrue(detector.isGreeting(query));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "hi, who are the top 5 scorers?",
            "hello, can you help me?",
            "hey there, what about LeBron?",
            "thanks for the stats",
            "hey can you show me the leaders",
            "What's up with the Lakers?",
            "hi 2 u",
            "hello hello hello hello hello hello hello",
            "good game last night"})
    @DisplayName("Greetings carrying any request or content are not pure greetings")
    void notGreetings(String query) {
        assertFalse(detector.isGreeting(query));
    }

    @Test
    @DisplayName("Null and empty input are not greetings")
    void nullAndEmpty() {
        assertFalse(detector.isGreeting(null));
        assertFalse(detector.isGreeting(""));
        assertFalse(detector.isGreeting("   "));
    }
}
