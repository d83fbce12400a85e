package com.loci.pojo.ai;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * opening_hours 既可能是 {"mon": "9-17"} 这样的对象，也可能是一整段字符串。
 * 字符串统一放到 "general" 键下。
 */
public class OpeningHoursDeserializer extends JsonDeserializer<Map<String, String>> {

    static final String GENERAL_KEY = "general";

    @Override
    public Map<String, String> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_STRING) {
            String text = p.getText();
            if (text == null || text.isBlank()) {
                return Collections.emptyMap();
            }
            Map<String, String> map = new LinkedHashMap<>();
            map.put(GENERAL_KEY, text);
            return map;
        }
        JsonNode node = p.readValueAsTree();
        if (node == null || !node.isObject()) {
            return Collections.emptyMap();
        }
        Map<String, String> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            map.put(e.getKey(), v == null || v.isNull() ? null : v.asText());
        }
        return map;
    }

    @Override
    public Map<String, String> getNullValue(DeserializationContext ctxt) {
        return null;
    }
}
