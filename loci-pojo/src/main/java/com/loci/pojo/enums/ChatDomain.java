package com.loci.pojo.enums;

/**
 * 对话消息所属领域，priority 越小优先级越高。
 */
public enum ChatDomain {

    ITINERARY("itinerary", 1),
    ACCOMMODATION("accommodation", 2),
    DINING("dining", 3),
    ACTIVITIES("activities", 4),
    GENERAL("general", 5);

    private final String code;
    private final int priority;

    ChatDomain(String code, int priority) {
        this.code = code;
        this.priority = priority;
    }

    public String getCode() {
        return code;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * 住宿/餐饮/活动属于领域专用回复，不产出行程 POI。
     */
    public boolean isDomainSpecific() {
        return this == ACCOMMODATION || this == DINING || this == ACTIVITIES;
    }
}
