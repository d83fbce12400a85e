package com.loci.server.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.loci.pojo.ai.GeneralCityData;
import com.loci.pojo.ai.ItineraryResponse;
import com.loci.pojo.ai.PoiDetailedInfo;
import com.loci.pojo.enums.ChatDomain;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次统一对话的生成结果快照，命中缓存时直接回放事件。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CachedChatReply {

    private ChatDomain domain;

    private String cityName;

    private GeneralCityData cityData;

    /** 通用 POI 或领域 POI */
    private List<PoiDetailedInfo> pois = new ArrayList<>();

    private ItineraryResponse itinerary;

    /** 助手回复的原始 JSON 文本 */
    private String responseText;
}
