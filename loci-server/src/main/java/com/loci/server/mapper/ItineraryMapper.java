package com.loci.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.loci.pojo.entity.Itinerary;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ItineraryMapper extends BaseMapper<Itinerary> {

    /**
     * 按 (user_id, city_id) 原子 upsert，返回行程 ID。
     * 并发写同一用户同一城市时由唯一约束 + ON CONFLICT 保证只有一行，来源交互以最后一次写入为准。
     */
    @Select("INSERT INTO itineraries (user_id, city_id, source_llm_interaction_id, created_at, updated_at) "
            + "VALUES (#{userId}, #{cityId}, #{interactionId}, NOW(), NOW()) "
            + "ON CONFLICT (user_id, city_id) DO UPDATE SET "
            + "updated_at = NOW(), source_llm_interaction_id = EXCLUDED.source_llm_interaction_id "
            + "RETURNING id")
    @Options(flushCache = Options.FlushCachePolicy.TRUE)
    Long upsertItinerary(@Param("userId") Long userId,
                         @Param("cityId") Long cityId,
                         @Param("interactionId") Long interactionId);
}
