package com.loci.server.ai.normalizer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loci.pojo.ai.PoiDetailedInfo;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 整个对象就是一个 POI（name 非空）。
 */
public class SinglePoiStrategy extends AbstractJsonPoiStrategy<PoiDetailedInfo> {

    public SinglePoiStrategy(ObjectMapper objectMapper) {
        super(objectMapper, PoiDetailedInfo.class);
    }

    @Override
    public String name() {
        return "single_poi";
    }

    @Override
    protected List<PoiDetailedInfo> extract(PoiDetailedInfo value) {
        List<PoiDetailedInfo> pois = new ArrayList<>();
        if (StringUtils.hasText(value.getName())) {
            pois.add(value);
        }
        return pois;
    }
}
