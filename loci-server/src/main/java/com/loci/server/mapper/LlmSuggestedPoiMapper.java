package com.loci.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.loci.pojo.entity.LlmSuggestedPoi;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface LlmSuggestedPoiMapper extends BaseMapper<LlmSuggestedPoi> {

    /**
     * 单条语句批量写入；任一行失败整条语句失败。
     * 同名同坐标的建议 POI 已存在时跳过该行，已有行（及其所属交互）保持不变。
     */
    @Insert({"<script>",
            "INSERT INTO llm_suggested_pois (user_id, search_profile_id, llm_interaction_id, city_id, name, ",
            "description_poi, category, address, website, latitude, longitude, location, created_at) VALUES ",
            "<foreach collection='pois' item='p' separator=','>",
            "(#{p.userId}, #{p.searchProfileId}, #{p.llmInteractionId}, #{p.cityId}, #{p.name}, ",
            "#{p.descriptionPoi}, #{p.category}, #{p.address}, #{p.website}, #{p.latitude}, #{p.longitude}, ",
            "ST_SetSRID(ST_MakePoint(#{p.longitude}, #{p.latitude}), 4326), NOW())",
            "</foreach>",
            " ON CONFLICT (name, latitude, longitude) DO NOTHING",
            "</script>"})
    int batchInsert(@Param("pois") List<LlmSuggestedPoi> pois);

    /**
     * 单个建议 POI：依赖 (name, latitude, longitude) 唯一约束原子去重，返回 ID。
     */
    @Select("INSERT INTO llm_suggested_pois (user_id, search_profile_id, llm_interaction_id, city_id, name, "
            + "description_poi, category, address, website, latitude, longitude, location, created_at) "
            + "VALUES (#{userId}, #{searchProfileId}, #{llmInteractionId}, #{cityId}, #{name}, "
            + "#{descriptionPoi}, #{category}, #{address}, #{website}, #{latitude}, #{longitude}, "
            + "ST_SetSRID(ST_MakePoint(#{longitude}, #{latitude}), 4326), NOW()) "
            + "ON CONFLICT (name, latitude, longitude) DO UPDATE SET name = EXCLUDED.name "
            + "RETURNING id")
    @Options(flushCache = Options.FlushCachePolicy.TRUE)
    Long upsertSingle(LlmSuggestedPoi poi);

    /**
     * 某次交互产生的建议 POI，按到参考点的距离（米）升序；cityId 为空时不按城市过滤。
     */
    @Select({"<script>",
            "SELECT id, user_id, search_profile_id, llm_interaction_id, city_id, name, description_poi, ",
            "category, address, website, latitude, longitude, created_at, ",
            "ST_Distance(location::geography, ",
            "ST_SetSRID(ST_MakePoint(#{longitude}, #{latitude}), 4326)::geography) AS distance ",
            "FROM llm_suggested_pois WHERE llm_interaction_id = #{interactionId} ",
            "<if test='cityId != null'> AND city_id = #{cityId} </if>",
            "AND location IS NOT NULL ",
            "ORDER BY distance ASC",
            "</script>"})
    List<LlmSuggestedPoi> listByInteractionSortedByDistance(@Param("interactionId") Long interactionId,
                                                            @Param("cityId") Long cityId,
                                                            @Param("longitude") double longitude,
                                                            @Param("latitude") double latitude);
}
