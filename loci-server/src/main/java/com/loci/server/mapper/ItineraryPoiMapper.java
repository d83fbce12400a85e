package com.loci.server.mapper;

import com.loci.pojo.entity.ItineraryPoi;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface ItineraryPoiMapper {

    /**
     * 多行 upsert：同一 (itinerary_id, poi_id) 再次加入时更新顺序与描述。
     * 调用方需保证 links 内 poi_id 不重复，否则 PostgreSQL 拒绝同一语句两次更新同一行。
     */
    @Insert({"<script>",
            "INSERT INTO itinerary_pois (itinerary_id, poi_id, order_index, ai_description, created_at, updated_at) VALUES ",
            "<foreach collection='links' item='l' separator=','>",
            "(#{l.itineraryId}, #{l.poiId}, #{l.orderIndex}, #{l.aiDescription}, NOW(), NOW())",
            "</foreach>",
            " ON CONFLICT (itinerary_id, poi_id) DO UPDATE SET ",
            "order_index = EXCLUDED.order_index, ai_description = EXCLUDED.ai_description, updated_at = NOW()",
            "</script>"})
    int batchUpsert(@Param("links") List<ItineraryPoi> links);
}
