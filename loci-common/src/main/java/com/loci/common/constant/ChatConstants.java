package com.loci.common.constant;

/**
 * 对话/生成流程中使用的常量。
 */
public class ChatConstants {

    private ChatConstants() {
    }

    /** 默认模型 */
    public static final String DEFAULT_MODEL = "gemini-2.0-flash";

    /** 默认采样温度 */
    public static final float DEFAULT_TEMPERATURE = 0.5f;

    /** 统一对话写入 llm_interactions.prompt 的前缀格式：domain, message */
    public static final String UNIFIED_CHAT_PROMPT_FORMAT = "Unified Chat - Domain: %s, Message: %s";

    /**
     * 旧版 prompt 标记：命中则说明是领域专用回复（餐饮/住宿/活动），不解析 POI。
     * 与历史数据保持兼容，字面量不能改。
     */
    public static final String MARKER_DINING = "Unified Chat - Domain: dining";
    public static final String MARKER_ACCOMMODATION = "Unified Chat - Domain: accommodation";
    public static final String MARKER_ACTIVITIES = "Unified Chat - Domain: activities";

    /** 响应中出现该字段即视为行程响应 */
    public static final String ITINERARY_NAME_MARKER = "itinerary_name";

    public static final String SESSION_STATUS_ACTIVE = "active";
    public static final String SESSION_STATUS_EXPIRED = "expired";
}
