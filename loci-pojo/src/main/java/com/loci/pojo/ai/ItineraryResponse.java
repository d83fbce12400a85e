package com.loci.pojo.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ItineraryResponse {

    @JsonProperty("itinerary_name")
    private String itineraryName;

    @JsonProperty("overall_description")
    private String overallDescription;

    @JsonProperty("points_of_interest")
    private List<PoiDetailedInfo> pointsOfInterest;
}
