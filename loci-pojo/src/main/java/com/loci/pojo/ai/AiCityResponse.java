package com.loci.pojo.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * 完整城市响应：城市概况 + 通用 POI + 行程。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AiCityResponse {

    @JsonProperty("general_city_data")
    private GeneralCityData generalCityData;

    @JsonProperty("points_of_interest")
    private List<PoiDetailedInfo> pointsOfInterest;

    @JsonProperty("itinerary_response")
    private ItineraryResponse itineraryResponse;

    @JsonProperty("session_id")
    private String sessionId;
}
