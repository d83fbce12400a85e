package com.loci.server.classifier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Aho-Corasick 多模式匹配自动机。
 *
 * - 关键词只支持 ASCII，匹配时对 A-Z 做小写折叠（大小写不敏感）；
 * - 只接受整词匹配：命中片段前后必须是文本边界或非字母数字字符；
 * - 构建完成后完全只读，search 只使用局部变量，可被任意多线程并发调用。
 *
 * @param <L> 关键词对应的标签类型
 */
public final class KeywordAutomaton<L> {

    private static final int ALPHABET = 128;

    /** 完整转移表 delta[state][c]，构建时已把失败链折叠进去 */
    private final int[][] delta;

    /** 每个状态上结束的关键词下标（含沿失败链继承来的） */
    private final int[][] outputs;

    private final int[] keywordLengths;

    private final List<L> keywordLabels;

    private KeywordAutomaton(int[][] delta, int[][] outputs, int[] keywordLengths, List<L> keywordLabels) {
        this.delta = delta;
        this.outputs = outputs;
        this.keywordLengths = keywordLengths;
        this.keywordLabels = keywordLabels;
    }

    public static <L> Builder<L> builder() {
        return new Builder<>();
    }

    /**
     * 单次扫描文本，返回所有整词命中的标签（按首次命中顺序）。
     */
    public Set<L> matchLabels(CharSequence text) {
        if (text == null || text.length() == 0) {
            return Collections.emptySet();
        }
        Set<L> labels = new LinkedHashSet<>();
        int state = 0;
        int len = text.length();
        for (int i = 0; i < len; i++) {
            char c = foldCase(text.charAt(i));
            if (c >= ALPHABET) {
                state = 0;
                continue;
            }
            state = delta[state][c];
            int[] out = outputs[state];
            if (out.length == 0) {
                continue;
            }
            boolean rightBoundary = i + 1 == len || !isWordChar(text.charAt(i + 1));
            if (!rightBoundary) {
                continue;
            }
            for (int k : out) {
                int start = i - keywordLengths[k] + 1;
                if (start == 0 || !isWordChar(text.charAt(start - 1))) {
                    labels.add(keywordLabels.get(k));
                }
            }
        }
        return labels;
    }

    public boolean matchesAny(CharSequence text) {
        return !matchLabels(text).isEmpty();
    }

    int stateCount() {
        return delta.length;
    }

    private static char foldCase(char c) {
        if (c >= 'A' && c <= 'Z') {
            return (char) (c + ('a' - 'A'));
        }
        return c;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c);
    }

    public static final class Builder<L> {

        private final Map<String, L> keywords = new HashMap<>();
        private final List<String> order = new ArrayList<>();

        private Builder() {
        }

        /**
         * 添加关键词；同一关键词重复添加时以最后一次的标签为准。
         */
        public Builder<L> add(String keyword, L label) {
            if (keyword == null || keyword.isBlank()) {
                throw new IllegalArgumentException("keyword must not be blank");
            }
            String k = keyword.trim().toLowerCase(Locale.ROOT);
            for (int i = 0; i < k.length(); i++) {
                if (k.charAt(i) >= ALPHABET) {
                    throw new IllegalArgumentException("keyword must be ASCII: " + keyword);
                }
            }
            if (keywords.put(k, label) == null) {
                order.add(k);
            }
            return this;
        }

        public Builder<L> addAll(Iterable<String> words, L label) {
            for (String w : words) {
                add(w, label);
            }
            return this;
        }

        public KeywordAutomaton<L> build() {
            List<int[]> gotoRows = new ArrayList<>();
            List<List<Integer>> outs = new ArrayList<>();
            gotoRows.add(newRow());
            outs.add(new ArrayList<>());

            int[] lengths = new int[order.size()];
            List<L> labels = new ArrayList<>(order.size());
            for (int k = 0; k < order.size(); k++) {
                String word = order.get(k);
                lengths[k] = word.length();
                labels.add(keywords.get(word));
                int state = 0;
                for (int i = 0; i < word.length(); i++) {
                    char c = word.charAt(i);
                    int next = gotoRows.get(state)[c];
                    if (next < 0) {
                        next = gotoRows.size();
                        gotoRows.add(newRow());
                        outs.add(new ArrayList<>());
                        gotoRows.get(state)[c] = next;
                    }
                    state = next;
                }
                outs.get(state).add(k);
            }

            int n = gotoRows.size();
            int[][] delta = new int[n][];
            int[] fail = new int[n];
            for (int s = 0; s < n; s++) {
                delta[s] = gotoRows.get(s).clone();
            }

            // BFS 计算失败链，并把缺失转移补成完整 DFA
            Deque<Integer> queue = new ArrayDeque<>();
            for (int c = 0; c < ALPHABET; c++) {
                int child = delta[0][c];
                if (child < 0) {
                    delta[0][c] = 0;
                } else {
                    fail[child] = 0;
                    queue.add(child);
                }
            }
            while (!queue.isEmpty()) {
                int s = queue.poll();
                outs.get(s).addAll(outs.get(fail[s]));
                for (int c = 0; c < ALPHABET; c++) {
                    int child = delta[s][c];
                    if (child < 0) {
                        delta[s][c] = delta[fail[s]][c];
                    } else {
                        fail[child] = delta[fail[s]][c];
                        queue.add(child);
                    }
                }
            }

            int[][] outputs = new int[n][];
            for (int s = 0; s < n; s++) {
                outputs[s] = outs.get(s).stream().distinct().mapToInt(Integer::intValue).toArray();
            }
            return new KeywordAutomaton<>(delta, outputs, lengths, Collections.unmodifiableList(labels));
        }

        private static int[] newRow() {
            int[] row = new int[ALPHABET];
            Arrays.fill(row, -1);
            return row;
        }
    }
}
