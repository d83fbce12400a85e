package com.loci.server.classifier;

import com.loci.pojo.enums.ChatIntent;

import java.util.List;
import java.util.Set;

/**
 * 意图识别：add &gt; remove &gt; question，均未命中时为 MODIFY_ITINERARY。
 */
public class IntentClassifier {

    static final List<String> ADD_KEYWORDS = List.of("add", "include", "visit");
    static final List<String> REMOVE_KEYWORDS = List.of("remove", "delete", "skip");
    static final List<String> QUESTION_KEYWORDS = List.of("what", "where", "how", "why", "when");

    private static final List<ChatIntent> PRIORITY = List.of(
            ChatIntent.ADD_POI, ChatIntent.REMOVE_POI, ChatIntent.ASK_QUESTION);

    private final KeywordAutomaton<ChatIntent> automaton;

    public IntentClassifier() {
        this.automaton = KeywordAutomaton.<ChatIntent>builder()
                .addAll(ADD_KEYWORDS, ChatIntent.ADD_POI)
                .addAll(REMOVE_KEYWORDS, ChatIntent.REMOVE_POI)
                .addAll(QUESTION_KEYWORDS, ChatIntent.ASK_QUESTION)
                .build();
    }

    public ChatIntent classify(String message) {
        Set<ChatIntent> hits = automaton.matchLabels(message);
        for (ChatIntent intent : PRIORITY) {
            if (hits.contains(intent)) {
                return intent;
            }
        }
        return ChatIntent.MODIFY_ITINERARY;
    }
}
