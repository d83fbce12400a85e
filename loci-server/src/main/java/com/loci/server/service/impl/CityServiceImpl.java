package com.loci.server.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.loci.pojo.ai.GeneralCityData;
import com.loci.pojo.entity.City;
import com.loci.server.mapper.CityMapper;
import com.loci.server.service.CityService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;

@Service
@Slf4j
public class CityServiceImpl extends ServiceImpl<CityMapper, City> implements CityService {

    @Override
    public Long findIdByName(String name) {
        if (!StringUtils.hasText(name)) {
            return null;
        }
        return baseMapper.findIdByName(name);
    }

    @Override
    public City findOrCreate(GeneralCityData cityData) {
        if (cityData == null || !StringUtils.hasText(cityData.getCity())) {
            return null;
        }
        City existing = baseMapper.findByNameAndCountry(cityData.getCity(), cityData.getCountry());
        if (existing != null) {
            return existing;
        }
        City city = new City();
        city.setName(cityData.getCity());
        city.setCountry(cityData.getCountry());
        city.setStateProvince(cityData.getStateProvince());
        city.setAiSummary(cityData.getDescription());
        city.setCenterLatitude(cityData.getCenterLatitude());
        city.setCenterLongitude(cityData.getCenterLongitude());
        city.setCreatedAt(LocalDateTime.now());
        baseMapper.insert(city);
        log.info("新建城市: id={}, name={}, country={}", city.getId(), city.getName(), city.getCountry());
        return city;
    }
}
