package com.loci.server.ai.normalizer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loci.pojo.ai.AiCityResponse;
import com.loci.pojo.ai.PoiDetailedInfo;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * {"data": {城市响应}}：合并 data.points_of_interest 与 data.itinerary_response.points_of_interest。
 */
public class DataWrapperStrategy extends AbstractJsonPoiStrategy<DataWrapperStrategy.Wrapper> {

    public DataWrapperStrategy(ObjectMapper objectMapper) {
        super(objectMapper, Wrapper.class);
    }

    @Override
    public String name() {
        return "data_wrapper";
    }

    @Override
    protected List<PoiDetailedInfo> extract(Wrapper value) {
        List<PoiDetailedInfo> pois = new ArrayList<>();
        AiCityResponse data = value.getData();
        if (data == null) {
            return pois;
        }
        addAll(pois, data.getPointsOfInterest());
        if (data.getItineraryResponse() != null) {
            addAll(pois, data.getItineraryResponse().getPointsOfInterest());
        }
        return pois;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Wrapper {
        private AiCityResponse data;
    }
}
