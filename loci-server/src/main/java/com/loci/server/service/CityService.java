package com.loci.server.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.loci.pojo.ai.GeneralCityData;
import com.loci.pojo.entity.City;

public interface CityService extends IService<City> {

    /**
     * 精确（区分大小写）按名称查城市 ID，未找到返回 null。
     */
    Long findIdByName(String name);

    /**
     * 按 (name, country) 查找城市，不存在则用 AI 城市数据新建。数据不完整返回 null。
     */
    City findOrCreate(GeneralCityData cityData);
}
