package com.loci.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.loci.pojo.entity.City;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface CityMapper extends BaseMapper<City> {

    /**
     * 精确匹配（区分大小写）城市名。
     */
    @Select("SELECT id FROM cities WHERE name = #{name} LIMIT 1")
    Long findIdByName(@Param("name") String name);

    @Select("SELECT * FROM cities WHERE name = #{name} AND COALESCE(country, '') = COALESCE(#{country}, '') LIMIT 1")
    City findByNameAndCountry(@Param("name") String name, @Param("country") String country);
}
