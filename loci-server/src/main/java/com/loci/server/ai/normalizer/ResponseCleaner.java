package com.loci.server.ai.normalizer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 模型文本清洗：去掉 markdown 代码块、前后说明文字、反引号与尾随逗号，只保留第一个完整 JSON 对象。
 */
public final class ResponseCleaner {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",(\\s*[}\\]])");

    private ResponseCleaner() {
    }

    public static String cleanJson(String response) {
        if (response == null) {
            return "";
        }
        String text = stripFence(response.trim());

        int start = text.indexOf('{');
        if (start < 0) {
            return text;
        }
        int end = findMatchingBrace(text, start);
        if (end < 0) {
            end = text.lastIndexOf('}');
            if (end <= start) {
                return text;
            }
        }

        String json = text.substring(start, end + 1).replace("`", "");
        json = TRAILING_COMMA.matcher(json).replaceAll("$1");
        return json.trim();
    }

    static String stripFence(String text) {
        Matcher m = FENCED_BLOCK.matcher(text);
        if (m.find()) {
            return m.group(1).trim();
        }
        String s = text;
        if (s.startsWith("```json")) {
            s = s.substring("```json".length());
        } else if (s.startsWith("```")) {
            s = s.substring(3);
        }
        if (s.endsWith("```")) {
            s = s.substring(0, s.length() - 3);
        }
        return s.trim();
    }

    /**
     * 从 start 处的 '{' 开始计数括号深度，字符串内的括号不计；返回深度归零处的下标，不平衡返回 -1。
     */
    static int findMatchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
                continue;
            }
            if (inString) {
                if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
