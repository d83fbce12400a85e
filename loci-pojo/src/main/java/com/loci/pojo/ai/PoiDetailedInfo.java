package com.loci.pojo.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 模型返回的单个 POI。字段都可能缺失，按宽松结构解析。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PoiDetailedInfo {

    private String city;

    private String name;

    @JsonProperty("description_poi")
    private String descriptionPoi;

    private String description;

    private Double distance;

    private Double latitude;

    private Double longitude;

    private String category;

    private Double rating;

    private String address;

    @JsonProperty("phone_number")
    private String phoneNumber;

    private String website;

    @JsonProperty("opening_hours")
    @JsonDeserialize(using = OpeningHoursDeserializer.class)
    private Map<String, String> openingHours;

    private List<String> images;

    @JsonProperty("price_range")
    private String priceRange;

    @JsonProperty("price_level")
    private String priceLevel;

    private List<String> tags;

    private Integer priority;

    @JsonProperty("cuisine_type")
    private String cuisineType;

    @JsonProperty("star_rating")
    private String starRating;

    private List<String> amenities;

    private String source;

    @JsonProperty("llm_interaction_id")
    private Long llmInteractionId;

    /**
     * 部分提示词要求 "coordinates": {"latitude": .., "longitude": ..}，展开到平铺字段。
     */
    @JsonProperty("coordinates")
    public void setCoordinates(Map<String, Double> coordinates) {
        if (coordinates == null) {
            return;
        }
        if (latitude == null) {
            latitude = coordinates.get("latitude");
        }
        if (longitude == null) {
            longitude = coordinates.get("longitude");
        }
    }

    /**
     * 优先 description_poi，其次 description。
     */
    public String resolveDescription() {
        if (descriptionPoi != null && !descriptionPoi.isBlank()) {
            return descriptionPoi;
        }
        return description;
    }
}
