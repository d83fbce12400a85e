package com.loci.server.service;

import com.loci.pojo.ai.ItineraryResponse;
import com.loci.pojo.dto.ConversationMessage;
import com.loci.pojo.dto.SessionContext;
import com.loci.pojo.vo.ChatSessionVO;

public interface ChatSessionService {

    ChatSessionVO createSession(Long userId, Long profileId, String cityName);

    /**
     * 不存在时抛 SESSION_NOT_FOUND。
     */
    ChatSessionVO getSession(String sessionId);

    /**
     * 整体覆盖（包括历史），last-writer-wins。
     */
    void updateSession(ChatSessionVO session);

    /**
     * 只更新城市、行程快照与上下文，不触碰对话历史。
     */
    void updateSessionState(String sessionId, String cityName, ItineraryResponse itinerary, SessionContext context);

    /**
     * 原子追加一条消息到历史末尾。
     */
    void appendMessage(String sessionId, ConversationMessage message);

    int expireStaleSessions();
}
