package com.loci.server.service;

import com.loci.pojo.ai.PoiDetailedInfo;
import com.loci.pojo.entity.LlmSuggestedPoi;
import com.loci.pojo.entity.PointOfInterest;

import java.util.List;

public interface PoiService {

    /**
     * 按 (name, cityId) 取规范化 POI 的 ID，不存在则创建。
     */
    Long getOrCreatePoi(String name, Long cityId, Double longitude, Double latitude,
                        String category, String description);

    /**
     * 批量保存建议 POI。interactionId 必须已存在，否则直接报错、不写入任何数据。
     *
     * @return 提交写入的建议 POI（已去重，不含数据库 ID；与已有同名同坐标行冲突的会被跳过）
     */
    List<LlmSuggestedPoi> saveLlmSuggestedPoisBatch(Long userId, Long searchProfileId, Long cityId,
                                                   Long interactionId, List<PoiDetailedInfo> pois);

    /**
     * 保存单个建议 POI，坐标必须合法；同名同坐标已存在时返回已有 ID。
     */
    Long saveSinglePoi(Long userId, Long cityId, Long interactionId, PoiDetailedInfo poi);

    List<LlmSuggestedPoi> listSuggestedPoisByDistance(Long interactionId, Long cityId,
                                                     double latitude, double longitude);

    List<PointOfInterest> listCityPoisByDistance(Long cityId, double latitude, double longitude);
}
