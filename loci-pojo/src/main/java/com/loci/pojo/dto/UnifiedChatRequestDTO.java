package com.loci.pojo.dto;

import lombok.Data;

/**
 * 统一对话（流式）请求。
 */
@Data
public class UnifiedChatRequestDTO {

    /** 用户消息（必填） */
    private String message;

    /** 城市，可为空，为空时沿用会话城市 */
    private String cityName;

    /** 已有会话 ID，为空时新建 */
    private String sessionId;

    private Long profileId;

    /** 自由文本偏好 */
    private String preferences;

    private Double userLatitude;

    private Double userLongitude;
}
