package com.loci.server.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.loci.pojo.entity.Itinerary;
import com.loci.pojo.entity.ItineraryPoi;

import java.util.List;

public interface ItineraryService extends IService<Itinerary> {

    /**
     * (user, city) 唯一；已存在时刷新 updated_at 与来源交互 ID。
     */
    Long upsertItinerary(Long userId, Long cityId, Long sourceInteractionId);

    /**
     * 批量 upsert 行程 POI 关联，返回写入（插入或更新）的条数。
     */
    int saveItineraryPois(Long itineraryId, List<ItineraryPoi> links);
}
