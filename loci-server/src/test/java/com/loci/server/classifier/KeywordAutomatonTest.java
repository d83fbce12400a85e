package com.loci.server.classifier;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KeywordAutomaton 单元测试：整词匹配、大小写、重叠关键词与失败链输出。
 */
class KeywordAutomatonTest {

    @Test
    void matchLabelsShouldOnlyHitWholeWords() {
        KeywordAutomaton<String> automaton = KeywordAutomaton.<String>builder()
                .add("bar", "dining")
                .add("eat", "dining")
                .build();

        assertEquals(Set.of("dining"), automaton.matchLabels("Any good bar nearby?"));
        assertTrue(automaton.matchLabels("I love Barcelona").isEmpty());
        assertTrue(automaton.matchLabels("great weather").isEmpty());
    }

    @Test
    void matchLabelsShouldIgnoreAsciiCase() {
        KeywordAutomaton<String> automaton = KeywordAutomaton.<String>builder()
                .add("hotel", "stay")
                .build();

        assertTrue(automaton.matchesAny("HOTEL in Paris"));
        assertTrue(automaton.matchesAny("a Hotel"));
    }

    @Test
    void matchLabelsShouldReportSuffixKeywordsThroughFailureLinks() {
        KeywordAutomaton<String> automaton = KeywordAutomaton.<String>builder()
                .add("she", "a")
                .add("he", "b")
                .add("hers", "c")
                .build();

        // "he" 作为 "she" 的后缀不是整词，不应命中
        assertEquals(Set.of("a"), automaton.matchLabels("she"));
        assertEquals(Set.of("b"), automaton.matchLabels("he"));
        assertEquals(Set.of("c"), automaton.matchLabels("hers"));
        assertEquals(Set.of("a", "b"), automaton.matchLabels("she said he"));
    }

    @Test
    void matchLabelsShouldKeepFirstHitOrder() {
        KeywordAutomaton<Integer> automaton = KeywordAutomaton.<Integer>builder()
                .addAll(List.of("one", "uno"), 1)
                .add("two", 2)
                .build();

        assertEquals(List.of(2, 1), List.copyOf(automaton.matchLabels("two then one")));
    }

    @Test
    void matchLabelsShouldResetOnNonAsciiCharacters() {
        KeywordAutomaton<String> automaton = KeywordAutomaton.<String>builder()
                .add("cafe", "dining")
                .build();

        assertTrue(automaton.matchLabels("café").isEmpty());
        assertTrue(automaton.matchesAny("咖啡 cafe"));
    }

    @Test
    void emptyOrNullTextShouldMatchNothing() {
        KeywordAutomaton<String> automaton = KeywordAutomaton.<String>builder()
                .add("plan", "itinerary")
                .build();

        assertTrue(automaton.matchLabels(null).isEmpty());
        assertTrue(automaton.matchLabels("").isEmpty());
        assertTrue(automaton.stateCount() >= 5);
    }

    @Test
    void builderShouldRejectBlankOrNonAsciiKeywords() {
        KeywordAutomaton.Builder<String> builder = KeywordAutomaton.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.add(" ", "x"));
        assertThrows(IllegalArgumentException.class, () -> builder.add("café", "x"));
    }
}
