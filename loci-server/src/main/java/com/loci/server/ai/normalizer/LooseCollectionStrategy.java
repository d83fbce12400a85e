package com.loci.server.ai.normalizer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loci.pojo.ai.PoiCollectionResponse;
import com.loci.pojo.ai.PoiDetailedInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * 宽松集合：points_of_interest / restaurants / hotels / activities 有哪个拼哪个。
 */
public class LooseCollectionStrategy extends AbstractJsonPoiStrategy<PoiCollectionResponse> {

    public LooseCollectionStrategy(ObjectMapper objectMapper) {
        super(objectMapper, PoiCollectionResponse.class);
    }

    @Override
    public String name() {
        return "loose_collection";
    }

    @Override
    protected List<PoiDetailedInfo> extract(PoiCollectionResponse value) {
        List<PoiDetailedInfo> pois = new ArrayList<>();
        addAll(pois, value.getPointsOfInterest());
        addAll(pois, value.getRestaurants());
        addAll(pois, value.getHotels());
        addAll(pois, value.getActivities());
        return pois;
    }
}
