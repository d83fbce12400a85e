package com.loci.server.ai.normalizer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ResponseCleaner 单元测试：代码块、前后说明文字、字符串内的括号与转义、尾随逗号。
 */
class ResponseCleanerTest {

    @Test
    void cleanJsonShouldBeIdempotentOnCleanInput() {
        String json = "{\"name\":\"Louvre\",\"tags\":[\"art\",\"museum\"]}";
        assertEquals(json, ResponseCleaner.cleanJson(json));
        assertEquals(json, ResponseCleaner.cleanJson(ResponseCleaner.cleanJson(json)));
    }

    @Test
    void cleanJsonShouldExtractFencedBlock() {
        String text = "Here you go:\n```json\n{\"city\": \"Paris\"}\n```\nEnjoy!";
        assertEquals("{\"city\": \"Paris\"}", ResponseCleaner.cleanJson(text));
    }

    @Test
    void cleanJsonShouldHandleUnclosedFence() {
        String text = "```json\n{\"city\": \"Lisbon\"}";
        assertEquals("{\"city\": \"Lisbon\"}", ResponseCleaner.cleanJson(text));
    }

    @Test
    void cleanJsonShouldDropSurroundingProse() {
        String text = "Sure! {\"a\": 1} Let me know if you need more {\"b\": 2}";
        assertEquals("{\"a\": 1}", ResponseCleaner.cleanJson(text));
    }

    @Test
    void bracesAndEscapedQuotesInsideStringsShouldNotCount() {
        String json = "{\"description\": \"a \\\"quoted\\\" } brace\", \"n\": {\"x\": 1}}";
        assertEquals(json, ResponseCleaner.cleanJson("prefix " + json + " suffix"));
        assertEquals(json.length() - 1, ResponseCleaner.findMatchingBrace(json, 0));
    }

    @Test
    void cleanJsonShouldRemoveTrailingCommas() {
        String text = "{\"items\": [1, 2, 3,], \"name\": \"x\",}";
        assertEquals("{\"items\": [1, 2, 3], \"name\": \"x\"}", ResponseCleaner.cleanJson(text));
    }

    @Test
    void unbalancedJsonShouldFallBackToLastBrace() {
        String text = "{\"a\": {\"b\": 1}";
        assertEquals(-1, ResponseCleaner.findMatchingBrace(text, 0));
        assertEquals("{\"a\": {\"b\": 1}", ResponseCleaner.cleanJson(text));
    }

    @Test
    void textWithoutObjectShouldBeReturnedTrimmed() {
        assertEquals("no json here", ResponseCleaner.cleanJson("  no json here  "));
        assertEquals("", ResponseCleaner.cleanJson(null));
    }
}
