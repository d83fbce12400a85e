package com.loci.server.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loci.common.constant.ChatConstants;
import com.loci.common.exception.BaseException;
import com.loci.common.properties.ChatProperties;
import com.loci.common.result.ErrorCode;
import com.loci.pojo.dto.ConversationMessage;
import com.loci.pojo.dto.SessionContext;
import com.loci.pojo.entity.ChatSession;
import com.loci.pojo.vo.ChatSessionVO;
import com.loci.server.mapper.ChatSessionMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChatSessionServiceImplTest {

    @Mock
    private ChatSessionMapper chatSessionMapper;

    private ChatSessionServiceImpl chatSessionService;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @BeforeEach
    void setUp() {
        ChatProperties properties = new ChatProperties();
        properties.setSessionTtlHours(6);
        chatSessionService = new ChatSessionServiceImpl(chatSessionMapper, objectMapper, properties);
    }

    @Test
    void createSessionShouldStartWithEmptyHistoryAndTtl() {
        ChatSessionVO vo = chatSessionService.createSession(7L, null, "Porto");

        ArgumentCaptor<ChatSession> captor = ArgumentCaptor.forClass(ChatSession.class);
        verify(chatSessionMapper).insertSession(captor.capture());
        ChatSession saved = captor.getValue();
        assertNotNull(saved.getId());
        assertEquals("[]", saved.getConversationHistory());
        assertEquals(ChatConstants.SESSION_STATUS_ACTIVE, saved.getStatus());
        assertEquals(Duration.ofHours(6), Duration.between(saved.getCreatedAt(), saved.getExpiresAt()));

        assertEquals(saved.getId(), vo.getId());
        assertTrue(vo.getConversationHistory().isEmpty());
        assertNotNull(vo.getSessionContext());
        assertNull(vo.getCurrentItinerary());
    }

    @Test
    void getSessionShouldRejectBlankAndMissingIds() {
        BaseException blank = assertThrows(BaseException.class, () -> chatSessionService.getSession(" "));
        assertEquals(ErrorCode.SESSION_NOT_FOUND.getCode(), blank.getCode().intValue());
        verifyNoInteractions(chatSessionMapper);

        when(chatSessionMapper.selectById("missing")).thenReturn(null);
        BaseException missing = assertThrows(BaseException.class, () -> chatSessionService.getSession("missing"));
        assertEquals(ErrorCode.SESSION_NOT_FOUND.getCode(), missing.getCode().intValue());
    }

    @Test
    void corruptJsonColumnsShouldFallBackInsteadOfFailing() {
        ChatSession row = new ChatSession();
        row.setId("s1");
        row.setUserId(7L);
        row.setConversationHistory("[{broken");
        row.setSessionContext("{\"lastDomain\": ");
        row.setCurrentItinerary("not json");
        when(chatSessionMapper.selectById("s1")).thenReturn(row);

        ChatSessionVO vo = chatSessionService.getSession("s1");

        assertTrue(vo.getConversationHistory().isEmpty());
        assertNotNull(vo.getSessionContext());
        assertNull(vo.getCurrentItinerary());
    }

    @Test
    void storedHistoryShouldBeReadBack() throws Exception {
        ChatSession row = new ChatSession();
        row.setId("s2");
        row.setConversationHistory(objectMapper.writeValueAsString(
                List.of(ConversationMessage.user("hello", "general"))));
        SessionContext context = new SessionContext();
        context.setLastDomain("dining");
        row.setSessionContext(objectMapper.writeValueAsString(context));
        when(chatSessionMapper.selectById("s2")).thenReturn(row);

        ChatSessionVO vo = chatSessionService.getSession("s2");

        assertEquals(1, vo.getConversationHistory().size());
        assertEquals("hello", vo.getConversationHistory().get(0).getContent());
        assertEquals("dining", vo.getSessionContext().getLastDomain());
    }

    @Test
    void appendMessageShouldStampTimeAndFailOnUnknownSession() {
        ConversationMessage message = new ConversationMessage(ConversationMessage.ROLE_USER, "hi", "general", null);
        when(chatSessionMapper.appendMessage(eq("gone"), anyString())).thenReturn(0);

        BaseException ex = assertThrows(BaseException.class, () -> chatSessionService.appendMessage("gone", message));

        assertEquals(ErrorCode.SESSION_NOT_FOUND.getCode(), ex.getCode().intValue());
        assertNotNull(message.getTimestamp());
    }

    @Test
    void updateSessionStateShouldNotTouchHistory() {
        when(chatSessionMapper.updateSessionState(eq("s3"), eq("Porto"), isNull(), anyString())).thenReturn(1);

        chatSessionService.updateSessionState("s3", "Porto", null, null);

        verify(chatSessionMapper, never()).updateSession(any());
        verify(chatSessionMapper).updateSessionState(eq("s3"), eq("Porto"), isNull(), contains("modificationHistory"));
    }
}
