package com.loci.server.ai.normalizer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loci.pojo.ai.PoiDetailedInfo;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 先把文本反序列化为 type，再由子类取出 POI 列表；反序列化失败视为不匹配。
 */
@Slf4j
abstract class AbstractJsonPoiStrategy<T> implements PoiParseStrategy {

    protected final ObjectMapper objectMapper;
    private final Class<T> type;

    protected AbstractJsonPoiStrategy(ObjectMapper objectMapper, Class<T> type) {
        this.objectMapper = objectMapper;
        this.type = type;
    }

    @Override
    public Optional<List<PoiDetailedInfo>> parse(String cleanedJson) {
        if (cleanedJson == null || cleanedJson.isBlank()) {
            return Optional.empty();
        }
        T value;
        try {
            value = objectMapper.readValue(cleanedJson, type);
        } catch (Exception e) {
            log.debug("POI strategy {} not applicable: {}", name(), e.getMessage());
            return Optional.empty();
        }
        if (value == null) {
            return Optional.empty();
        }
        List<PoiDetailedInfo> pois = extract(value);
        return nonEmpty(pois);
    }

    protected abstract List<PoiDetailedInfo> extract(T value);

    protected static void addAll(List<PoiDetailedInfo> target, List<PoiDetailedInfo> source) {
        if (source != null) {
            source.stream().filter(Objects::nonNull).forEach(target::add);
        }
    }

    protected static Optional<List<PoiDetailedInfo>> nonEmpty(List<PoiDetailedInfo> pois) {
        if (pois == null || pois.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ArrayList<>(pois));
    }
}
