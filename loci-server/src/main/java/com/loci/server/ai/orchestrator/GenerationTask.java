package com.loci.server.ai.orchestrator;

import com.loci.pojo.enums.ChatDomain;

/**
 * 生成任务标签，合并结果时只认标签，不依赖完成顺序。
 */
public enum GenerationTask {

    CITY_DATA("city_data", "city data"),
    GENERAL_POIS("general_pois", "general POI"),
    PERSONALIZED_POIS("personalized_pois", "personalized POI"),
    DINING("dining", "dining"),
    ACCOMMODATION("accommodation", "accommodation"),
    ACTIVITIES("activities", "activities");

    private final String code;
    private final String label;

    GenerationTask(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 领域专用任务；其它领域返回 null。
     */
    public static GenerationTask forDomain(ChatDomain domain) {
        if (domain == null) {
            return null;
        }
        switch (domain) {
            case DINING:
                return DINING;
            case ACCOMMODATION:
                return ACCOMMODATION;
            case ACTIVITIES:
                return ACTIVITIES;
            default:
                return null;
        }
    }
}
