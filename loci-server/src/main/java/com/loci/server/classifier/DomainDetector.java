package com.loci.server.classifier;

import com.loci.pojo.enums.ChatDomain;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 领域识别：一次扫描匹配四组关键词（含复数形式），多领域命中时按优先级
 * itinerary &gt; accommodation &gt; dining &gt; activities 取最高者，未命中为 GENERAL。
 */
public class DomainDetector {

    static final Map<ChatDomain, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(ChatDomain.ACCOMMODATION, List.of("hotel", "hostel", "accommodation", "stay", "sleep",
                "room", "booking", "airbnb", "lodge", "resort", "guesthouse"));
        KEYWORDS.put(ChatDomain.DINING, List.of("restaurant", "food", "eat", "dine", "meal", "cuisine",
                "drink", "cafe", "bar", "lunch", "dinner", "breakfast", "brunch"));
        KEYWORDS.put(ChatDomain.ACTIVITIES, List.of("activity", "museum", "park", "attraction", "tour",
                "visit", "see", "do", "experience", "adventure", "shopping", "nightlife"));
        KEYWORDS.put(ChatDomain.ITINERARY, List.of("itinerary", "plan", "schedule", "trip", "day", "week",
                "journey", "route", "organize", "arrange"));
    }

    private final KeywordAutomaton<ChatDomain> automaton;

    public DomainDetector() {
        KeywordAutomaton.Builder<ChatDomain> builder = KeywordAutomaton.builder();
        KEYWORDS.forEach((domain, words) -> {
            for (String w : words) {
                builder.add(w, domain);
                builder.add(pluralOf(w), domain);
            }
        });
        this.automaton = builder.build();
    }

    public ChatDomain detect(String message) {
        Set<ChatDomain> hits = automaton.matchLabels(message);
        return hits.stream()
                .min(Comparator.comparingInt(ChatDomain::getPriority))
                .orElse(ChatDomain.GENERAL);
    }

    /**
     * 英文规则复数：辅音 + y → ies；s/x/z/ch/sh 结尾 → es；其余 + s。
     */
    static String pluralOf(String word) {
        int n = word.length();
        if (n > 1 && word.endsWith("y") && !isVowel(word.charAt(n - 2))) {
            return word.substring(0, n - 1) + "ies";
        }
        if (word.endsWith("s") || word.endsWith("x") || word.endsWith("z")
                || word.endsWith("ch") || word.endsWith("sh")) {
            return word + "es";
        }
        return word + "s";
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }
}
