package com.loci.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.loci.pojo.entity.PointOfInterest;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface PointOfInterestMapper extends BaseMapper<PointOfInterest> {

    @Select("SELECT id FROM points_of_interest WHERE name = #{name} AND city_id = #{cityId} LIMIT 1")
    Long findIdByNameAndCity(@Param("name") String name, @Param("cityId") Long cityId);

    /**
     * 插入规范化 POI；(name, city_id) 已存在时不改数据，直接返回已有行的 ID。
     * 坐标顺序：ST_MakePoint(经度, 纬度)。
     */
    @Select("INSERT INTO points_of_interest (name, city_id, location, category, description, created_at) "
            + "VALUES (#{name}, #{cityId}, "
            + "ST_SetSRID(ST_MakePoint(#{longitude,jdbcType=DOUBLE}, #{latitude,jdbcType=DOUBLE}), 4326), "
            + "#{category}, #{description}, NOW()) "
            + "ON CONFLICT (name, city_id) DO UPDATE SET name = EXCLUDED.name "
            + "RETURNING id")
    @Options(flushCache = Options.FlushCachePolicy.TRUE)
    Long insertOrGetId(@Param("name") String name,
                       @Param("cityId") Long cityId,
                       @Param("longitude") Double longitude,
                       @Param("latitude") Double latitude,
                       @Param("category") String category,
                       @Param("description") String description);

    /**
     * 城市内 POI 按到参考点的球面距离（米）升序。
     */
    @Select("SELECT id, name, city_id, category, description, created_at, "
            + "ST_Y(location) AS latitude, ST_X(location) AS longitude, "
            + "ST_Distance(location::geography, "
            + "ST_SetSRID(ST_MakePoint(#{longitude}, #{latitude}), 4326)::geography) AS distance "
            + "FROM points_of_interest "
            + "WHERE city_id = #{cityId} AND location IS NOT NULL "
            + "ORDER BY distance ASC")
    List<PointOfInterest> listByCitySortedByDistance(@Param("cityId") Long cityId,
                                                     @Param("longitude") double longitude,
                                                     @Param("latitude") double latitude);
}
