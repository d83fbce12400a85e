package com.loci.pojo.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话历史中的一条消息。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessage {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private String role;

    private String content;

    /** 消息所属领域（itinerary / dining ...） */
    private String domain;

    private LocalDateTime timestamp;

    public static ConversationMessage user(String content, String domain) {
        return new ConversationMessage(ROLE_USER, content, domain, LocalDateTime.now());
    }

    public static ConversationMessage assistant(String content, String domain) {
        return new ConversationMessage(ROLE_ASSISTANT, content, domain, LocalDateTime.now());
    }
}
