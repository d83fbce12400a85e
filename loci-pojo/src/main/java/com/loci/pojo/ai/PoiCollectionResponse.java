package com.loci.pojo.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * 宽松集合结构：任意包含 points_of_interest / restaurants / hotels / activities 数组的对象。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PoiCollectionResponse {

    @JsonProperty("points_of_interest")
    private List<PoiDetailedInfo> pointsOfInterest;

    private List<PoiDetailedInfo> restaurants;

    private List<PoiDetailedInfo> hotels;

    private List<PoiDetailedInfo> activities;
}
