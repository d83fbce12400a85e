package com.loci.server.ai.normalizer;

import com.loci.pojo.ai.PoiDetailedInfo;

import java.util.List;
import java.util.Optional;

/**
 * 一种结构解读方式：输入已清洗的 JSON 文本，能解析出非空 POI 列表时返回，否则返回 empty。
 * 实现不得抛出异常。
 */
public interface PoiParseStrategy {

    String name();

    Optional<List<PoiDetailedInfo>> parse(String cleanedJson);
}
