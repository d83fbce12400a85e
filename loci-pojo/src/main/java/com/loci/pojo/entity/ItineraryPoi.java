package com.loci.pojo.entity;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 行程与 POI 的关联，主键 (itinerary_id, poi_id)。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@TableName("itinerary_pois")
public class ItineraryPoi {

    private Long itineraryId;

    private Long poiId;

    private Integer orderIndex;

    /** AI 针对该行程给出的描述 */
    private String aiDescription;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public ItineraryPoi(Long itineraryId, Long poiId, Integer orderIndex, String aiDescription) {
        this.itineraryId = itineraryId;
        this.poiId = poiId;
        this.orderIndex = orderIndex;
        this.aiDescription = aiDescription;
    }
}
