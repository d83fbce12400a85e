package com.loci.pojo.ai;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 模型返回的城市概况。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeneralCityData {

    @JsonProperty("city")
    @JsonAlias({"city_name", "name"})
    private String city;

    private String country;

    @JsonProperty("state_province")
    private String stateProvince;

    private String description;

    @JsonProperty("center_latitude")
    private Double centerLatitude;

    @JsonProperty("center_longitude")
    private Double centerLongitude;

    private String population;

    private String area;

    private String timezone;

    private String language;

    private String weather;

    private String attractions;

    private String history;
}
