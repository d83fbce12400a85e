package com.loci.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 对话会话。行程快照、对话历史与上下文以 JSON 文本（jsonb 列）保存。
 */
@Data
@TableName("chat_sessions")
public class ChatSession {

    @TableId(type = IdType.INPUT)
    private String id;

    private Long userId;

    private Long profileId;

    private String cityName;

    /** ItineraryResponse JSON */
    private String currentItinerary;

    /** ConversationMessage 数组 JSON，只追加 */
    private String conversationHistory;

    /** SessionContext JSON */
    private String sessionContext;

    /** active / expired */
    private String status;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime expiresAt;
}
