package com.loci.server.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loci.common.constant.ChatConstants;
import com.loci.common.exception.BaseException;
import com.loci.common.exception.PersistenceException;
import com.loci.common.properties.ChatProperties;
import com.loci.common.result.ErrorCode;
import com.loci.pojo.ai.ItineraryResponse;
import com.loci.pojo.dto.ConversationMessage;
import com.loci.pojo.dto.SessionContext;
import com.loci.pojo.entity.ChatSession;
import com.loci.pojo.vo.ChatSessionVO;
import com.loci.server.mapper.ChatSessionMapper;
import com.loci.server.service.ChatSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 会话存储：行程快照 / 历史 / 上下文以 JSON 存 jsonb 列，对核心流程不透明。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatSessionServiceImpl implements ChatSessionService {

    private static final TypeReference<List<ConversationMessage>> HISTORY_TYPE = new TypeReference<>() {
    };

    private final ChatSessionMapper chatSessionMapper;
    private final ObjectMapper objectMapper;
    private final ChatProperties chatProperties;

    @Override
    public ChatSessionVO createSession(Long userId, Long profileId, String cityName) {
        LocalDateTime now = LocalDateTime.now();
        ChatSession session = new ChatSession();
        session.setId(UUID.randomUUID().toString());
        session.setUserId(userId);
        session.setProfileId(profileId);
        session.setCityName(cityName);
        session.setCurrentItinerary(null);
        session.setConversationHistory("[]");
        session.setSessionContext(toJson(new SessionContext()));
        session.setStatus(ChatConstants.SESSION_STATUS_ACTIVE);
        session.setCreatedAt(now);
        session.setUpdatedAt(now);
        session.setExpiresAt(now.plusHours(chatProperties.getSessionTtlHours()));
        chatSessionMapper.insertSession(session);
        log.info("新建会话: sessionId={}, userId={}, cityName={}", session.getId(), userId, cityName);
        return toVO(session);
    }

    @Override
    public ChatSessionVO getSession(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            throw new BaseException(ErrorCode.SESSION_NOT_FOUND);
        }
        ChatSession session = chatSessionMapper.selectById(sessionId);
        if (session == null) {
            throw new BaseException(ErrorCode.SESSION_NOT_FOUND);
        }
        return toVO(session);
    }

    @Override
    public void updateSession(ChatSessionVO vo) {
        ChatSession session = new ChatSession();
        session.setId(vo.getId());
        session.setCityName(vo.getCityName());
        session.setCurrentItinerary(vo.getCurrentItinerary() == null ? null : toJson(vo.getCurrentItinerary()));
        session.setConversationHistory(toJson(vo.getConversationHistory() == null
                ? new ArrayList<>() : vo.getConversationHistory()));
        session.setSessionContext(toJson(vo.getSessionContext() == null ? new SessionContext() : vo.getSessionContext()));
        session.setStatus(vo.getStatus());
        session.setUpdatedAt(LocalDateTime.now());
        session.setExpiresAt(vo.getExpiresAt());
        int rows = chatSessionMapper.updateSession(session);
        if (rows == 0) {
            throw new BaseException(ErrorCode.SESSION_NOT_FOUND);
        }
    }

    @Override
    public void updateSessionState(String sessionId, String cityName, ItineraryResponse itinerary, SessionContext context) {
        int rows = chatSessionMapper.updateSessionState(sessionId, cityName,
                itinerary == null ? null : toJson(itinerary),
                toJson(context == null ? new SessionContext() : context));
        if (rows == 0) {
            throw new BaseException(ErrorCode.SESSION_NOT_FOUND);
        }
    }

    @Override
    public void appendMessage(String sessionId, ConversationMessage message) {
        if (message == null) {
            return;
        }
        if (message.getTimestamp() == null) {
            message.setTimestamp(LocalDateTime.now());
        }
        int rows = chatSessionMapper.appendMessage(sessionId, toJson(message));
        if (rows == 0) {
            throw new BaseException(ErrorCode.SESSION_NOT_FOUND);
        }
    }

    @Override
    public int expireStaleSessions() {
        return chatSessionMapper.expireStaleSessions();
    }

    ChatSessionVO toVO(ChatSession session) {
        ChatSessionVO vo = new ChatSessionVO();
        vo.setId(session.getId());
        vo.setUserId(session.getUserId());
        vo.setProfileId(session.getProfileId());
        vo.setCityName(session.getCityName());
        vo.setCurrentItinerary(readOrNull(session.getCurrentItinerary(), ItineraryResponse.class, session.getId()));
        List<ConversationMessage> history = readHistory(session.getConversationHistory(), session.getId());
        vo.setConversationHistory(history);
        SessionContext context = readOrNull(session.getSessionContext(), SessionContext.class, session.getId());
        vo.setSessionContext(context == null ? new SessionContext() : context);
        vo.setStatus(session.getStatus());
        vo.setCreatedAt(session.getCreatedAt());
        vo.setUpdatedAt(session.getUpdatedAt());
        vo.setExpiresAt(session.getExpiresAt());
        return vo;
    }

    private List<ConversationMessage> readHistory(String json, String sessionId) {
        if (!StringUtils.hasText(json)) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, HISTORY_TYPE));
        } catch (JsonProcessingException e) {
            // 历史 JSON 损坏不应导致会话不可用，回退为空历史
            log.warn("会话历史 JSON 解析失败: sessionId={}, error={}", sessionId, e.getMessage());
            return new ArrayList<>();
        }
    }

    private <T> T readOrNull(String json, Class<T> type, String sessionId) {
        if (!StringUtils.hasText(json) || "null".equals(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("会话 JSON 字段解析失败: sessionId={}, type={}, error={}", sessionId, type.getSimpleName(), e.getMessage());
            return null;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("serialize_session", "failed to serialize session field", e);
        }
    }
}
