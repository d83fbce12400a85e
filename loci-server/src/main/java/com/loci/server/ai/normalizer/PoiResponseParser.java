package com.loci.server.ai.normalizer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loci.common.constant.ChatConstants;
import com.loci.pojo.ai.PoiDetailedInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 从模型文本中提取 POI 列表。
 *
 * 流程：
 * 1. 清洗文本（ResponseCleaner）；
 * 2. 含 itinerary_name 的视为行程响应，直接返回空列表；
 * 3. 按固定顺序尝试各解析策略，第一个给出非空列表的胜出；
 * 4. 全部失败只记 warn 日志并返回空列表，从不抛异常。
 */
@Component
@Slf4j
public class PoiResponseParser {

    private final List<PoiParseStrategy> strategies;

    @Autowired
    public PoiResponseParser(ObjectMapper objectMapper) {
        this(List.of(
                new DataWrapperStrategy(objectMapper),
                new CityResponseStrategy(objectMapper),
                new LooseCollectionStrategy(objectMapper),
                new SinglePoiStrategy(objectMapper)));
    }

    PoiResponseParser(List<PoiParseStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public List<PoiDetailedInfo> parse(String responseText) {
        if (!StringUtils.hasText(responseText)) {
            return Collections.emptyList();
        }
        String cleaned = ResponseCleaner.cleanJson(responseText);
        if (cleaned.contains(ChatConstants.ITINERARY_NAME_MARKER)) {
            log.debug("响应包含 itinerary_name，按行程响应处理，不解析 POI");
            return Collections.emptyList();
        }
        for (PoiParseStrategy strategy : strategies) {
            Optional<List<PoiDetailedInfo>> result;
            try {
                result = strategy.parse(cleaned);
            } catch (RuntimeException e) {
                log.warn("POI 解析策略异常: strategy={}, error={}", strategy.name(), e.getMessage());
                continue;
            }
            if (result.isPresent() && !result.get().isEmpty()) {
                log.debug("POI 解析成功: strategy={}, count={}", strategy.name(), result.get().size());
                return result.get();
            }
        }
        log.warn("无法从响应中解析出 POI，返回空列表: responseLength={}", responseText.length());
        return Collections.emptyList();
    }
}
