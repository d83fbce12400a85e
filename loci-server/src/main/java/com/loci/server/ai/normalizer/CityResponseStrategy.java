package com.loci.server.ai.normalizer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loci.pojo.ai.AiCityResponse;
import com.loci.pojo.ai.PoiDetailedInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * 直接按城市响应结构解析。
 */
public class CityResponseStrategy extends AbstractJsonPoiStrategy<AiCityResponse> {

    public CityResponseStrategy(ObjectMapper objectMapper) {
        super(objectMapper, AiCityResponse.class);
    }

    @Override
    public String name() {
        return "city_response";
    }

    @Override
    protected List<PoiDetailedInfo> extract(AiCityResponse value) {
        List<PoiDetailedInfo> pois = new ArrayList<>();
        addAll(pois, value.getPointsOfInterest());
        if (value.getItineraryResponse() != null) {
            addAll(pois, value.getItineraryResponse().getPointsOfInterest());
        }
        return pois;
    }
}
