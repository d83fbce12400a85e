package com.loci.pojo.vo;

import com.loci.pojo.ai.GeneralCityData;
import com.loci.pojo.ai.PoiDetailedInfo;
import com.loci.pojo.entity.LlmSuggestedPoi;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 三路生成结果合并后的视图。某一路失败时对应字段为空，错误记录在 errors 中（key 为任务名）。
 */
@Data
public class CityBundleVO {

    private String cityName;

    /** 城市落库后的 ID（未落库时为空） */
    private Long cityId;

    private GeneralCityData cityData;

    private List<PoiDetailedInfo> generalPois = new ArrayList<>();

    private String itineraryName;

    private String overallDescription;

    private List<PoiDetailedInfo> personalizedPois = new ArrayList<>();

    /** 个性化任务写入的交互记录 */
    private Long llmInteractionId;

    /** 按距离排序后的建议 POI（落库后才有） */
    private List<LlmSuggestedPoi> rankedSuggestedPois = new ArrayList<>();

    private Map<String, String> errors = new LinkedHashMap<>();

    public boolean hasError(String task) {
        return errors.containsKey(task);
    }
}
