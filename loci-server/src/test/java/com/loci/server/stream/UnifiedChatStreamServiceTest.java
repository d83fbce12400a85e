package com.loci.server.stream;

import com.loci.common.exception.BaseException;
import com.loci.common.properties.AiProperties;
import com.loci.common.properties.ChatProperties;
import com.loci.common.result.ErrorCode;
import com.loci.pojo.ai.GeneralCityData;
import com.loci.pojo.ai.PoiDetailedInfo;
import com.loci.pojo.dto.ConversationMessage;
import com.loci.pojo.dto.SessionContext;
import com.loci.pojo.dto.UnifiedChatRequestDTO;
import com.loci.pojo.entity.LlmInteraction;
import com.loci.pojo.enums.ChatDomain;
import com.loci.pojo.enums.ChatIntent;
import com.loci.pojo.vo.ChatSessionVO;
import com.loci.pojo.vo.StreamEventVO;
import com.loci.server.ai.orchestrator.GenerationResult;
import com.loci.server.ai.orchestrator.GenerationTask;
import com.loci.server.ai.orchestrator.GenerationWorkers;
import com.loci.server.ai.orchestrator.ParallelGenerationRunner;
import com.loci.server.cache.CachedChatReply;
import com.loci.server.cache.GenerationCache;
import com.loci.server.classifier.MessageClassifier;
import com.loci.server.metrics.MetricsRecorder;
import com.loci.server.service.ChatSessionService;
import com.loci.server.service.LlmInteractionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 统一对话流水线：事件顺序、缓存回放、全部失败与落库失败的处理。
 */
@ExtendWith(MockitoExtension.class)
class UnifiedChatStreamServiceTest {

    private static final String DINING_MESSAGE = "Where should I eat seafood?";

    @Mock
    private ChatSessionService chatSessionService;

    @Mock
    private GenerationWorkers generationWorkers;

    @Mock
    private LlmInteractionService llmInteractionService;

    @Mock
    private GenerationCache generationCache;

    @Mock
    private MetricsRecorder metricsRecorder;

    private ExecutorService executor;
    private UnifiedChatStreamService streamService;
    private StreamEventSink sink;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        ChatProperties properties = new ChatProperties();
        properties.setWorkerTimeoutSeconds(5);
        streamService = new UnifiedChatStreamService(new MessageClassifier(), chatSessionService, generationWorkers,
                new ParallelGenerationRunner(executor, properties), llmInteractionService, generationCache,
                new AiProperties());
        sink = new StreamEventSink(64, 100, 0, metricsRecorder);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void process_shouldStreamDomainResultsAndSaveTypedInteraction() throws Exception {
        when(chatSessionService.createSession(7L, null, "Lisbon")).thenReturn(session("s1"));
        when(generationCache.get(anyString())).thenReturn(null);
        when(generationWorkers.cityData("Lisbon")).thenReturn(cityResult());
        when(generationWorkers.domainPois(ChatDomain.DINING, "Lisbon", null, null, null)).thenReturn(diningResult());
        when(llmInteractionService.saveInteraction(any(LlmInteraction.class))).thenReturn(42L);

        String sessionId = streamService.process(request(DINING_MESSAGE, "Lisbon", null), 7L, sink);

        assertEquals("s1", sessionId);
        List<StreamEventVO> events = drain();
        assertEquals(StreamEventVO.TYPE_START, events.get(0).getType());
        assertEquals(StreamEventVO.TYPE_CLASSIFICATION, events.get(1).getType());
        StreamEventVO last = events.get(events.size() - 1);
        assertEquals(StreamEventVO.TYPE_COMPLETE, last.getType());
        assertTrue(last.isFinal());
        assertEquals(42L, ((Map<?, ?>) last.getData()).get("llmInteractionId"));
        assertTrue(events.stream().anyMatch(e -> StreamEventVO.TYPE_CHUNK.equals(e.getType()) && "dining".equals(e.getPart())));
        assertTrue(events.stream().anyMatch(e -> StreamEventVO.TYPE_CITY_DATA.equals(e.getType())));
        assertTrue(events.stream().noneMatch(e -> StreamEventVO.TYPE_ERROR.equals(e.getType())));

        ArgumentCaptor<LlmInteraction> interaction = ArgumentCaptor.forClass(LlmInteraction.class);
        verify(llmInteractionService).saveInteraction(interaction.capture());
        assertEquals("Unified Chat - Domain: dining, Message: " + DINING_MESSAGE, interaction.getValue().getPrompt());
        assertEquals(ChatDomain.DINING, interaction.getValue().getDomain());
        assertEquals("s1", interaction.getValue().getSessionId());

        verify(generationWorkers, never()).generalPois(anyString());
        verify(generationCache).put(anyString(), any(CachedChatReply.class));
        verify(chatSessionService, times(2)).appendMessage(eq("s1"), any(ConversationMessage.class));
        ArgumentCaptor<SessionContext> context = ArgumentCaptor.forClass(SessionContext.class);
        verify(chatSessionService).updateSessionState(eq("s1"), eq("Lisbon"), isNull(), context.capture());
        assertEquals("dining", context.getValue().getLastDomain());
        assertEquals("ask_question", context.getValue().getLastIntent());
    }

    @Test
    void process_shouldReplayCachedReplyWithoutCallingModel() throws Exception {
        when(chatSessionService.getSession("s1")).thenReturn(session("s1", "Lisbon"));
        CachedChatReply cached = new CachedChatReply();
        cached.setDomain(ChatDomain.DINING);
        cached.setCityName("Lisbon");
        cached.setPois(diningResult().getPois());
        cached.setResponseText("{\"restaurants\": []}");
        when(generationCache.get(anyString())).thenReturn(cached);

        streamService.process(request(DINING_MESSAGE, null, "s1"), 7L, sink);

        List<StreamEventVO> events = drain();
        assertTrue(events.stream().anyMatch(e -> StreamEventVO.TYPE_CHUNK.equals(e.getType()) && "dining".equals(e.getPart())));
        assertEquals(StreamEventVO.TYPE_COMPLETE, events.get(events.size() - 1).getType());
        verifyNoInteractions(generationWorkers, llmInteractionService);
        verify(generationCache, never()).put(anyString(), any());
    }

    @Test
    void process_shouldEndWithErrorAndComplete_whenAllTasksFail() throws Exception {
        when(chatSessionService.createSession(7L, null, "Lisbon")).thenReturn(session("s1"));
        when(generationCache.get(anyString())).thenReturn(null);
        when(generationWorkers.cityData("Lisbon"))
                .thenReturn(GenerationResult.failure(GenerationTask.CITY_DATA, "boom"));
        when(generationWorkers.domainPois(ChatDomain.DINING, "Lisbon", null, null, null))
                .thenReturn(GenerationResult.failure(GenerationTask.DINING, "boom"));

        streamService.process(request(DINING_MESSAGE, "Lisbon", null), 7L, sink);

        List<StreamEventVO> events = drain();
        StreamEventVO beforeLast = events.get(events.size() - 2);
        assertEquals(StreamEventVO.TYPE_ERROR, beforeLast.getType());
        assertEquals(UnifiedChatStreamService.PART_PIPELINE, beforeLast.getPart());
        assertEquals(StreamEventVO.TYPE_COMPLETE, events.get(events.size() - 1).getType());
        verifyNoInteractions(llmInteractionService);
        verify(chatSessionService, never()).updateSessionState(anyString(), anyString(), any(), any());
        verify(generationCache, never()).put(anyString(), any());
    }

    @Test
    void process_shouldKeepGoing_whenInteractionCannotBeSaved() throws Exception {
        when(chatSessionService.createSession(7L, null, "Lisbon")).thenReturn(session("s1"));
        when(generationCache.get(anyString())).thenReturn(null);
        when(generationWorkers.cityData("Lisbon")).thenReturn(cityResult());
        when(generationWorkers.domainPois(ChatDomain.DINING, "Lisbon", null, null, null)).thenReturn(diningResult());
        when(llmInteractionService.saveInteraction(any(LlmInteraction.class)))
                .thenThrow(new DataIntegrityViolationException("disk full"));

        streamService.process(request(DINING_MESSAGE, "Lisbon", null), 7L, sink);

        List<StreamEventVO> events = drain();
        assertTrue(events.stream().anyMatch(e -> StreamEventVO.TYPE_ERROR.equals(e.getType())
                && UnifiedChatStreamService.PART_PERSISTENCE.equals(e.getPart())));
        assertEquals(StreamEventVO.TYPE_COMPLETE, events.get(events.size() - 1).getType());
        verify(chatSessionService).updateSessionState(eq("s1"), eq("Lisbon"), isNull(), any(SessionContext.class));
    }

    @Test
    void process_shouldRequireCity_forNewConversation() {
        BaseException ex = assertThrows(BaseException.class,
                () -> streamService.process(request(DINING_MESSAGE, null, null), 7L, sink));

        assertEquals(ErrorCode.INVALID_PARAM.getCode(), ex.getCode().intValue());
        verifyNoInteractions(chatSessionService, generationWorkers);
    }

    @Test
    void nextContext_shouldRecordModificationsOnly() {
        SessionContext context = new SessionContext();
        context.setModificationHistory(null);

        UnifiedChatStreamService.nextContext(context, ChatDomain.ACTIVITIES, ChatIntent.ASK_QUESTION, null);
        assertTrue(context.getModificationHistory().isEmpty());

        UnifiedChatStreamService.nextContext(context, ChatDomain.ITINERARY, ChatIntent.ADD_POI, " vegan ");
        assertEquals(List.of("add_poi:itinerary"), context.getModificationHistory());
        assertEquals("vegan", context.getPreferences());
        assertEquals("itinerary", context.getLastDomain());
    }

    private List<StreamEventVO> drain() throws InterruptedException {
        List<StreamEventVO> events = new ArrayList<>();
        StreamEventVO event;
        while ((event = sink.poll(10, TimeUnit.MILLISECONDS)) != null) {
            events.add(event);
        }
        return events;
    }

    private static UnifiedChatRequestDTO request(String message, String cityName, String sessionId) {
        UnifiedChatRequestDTO request = new UnifiedChatRequestDTO();
        request.setMessage(message);
        request.setCityName(cityName);
        request.setSessionId(sessionId);
        return request;
    }

    private static ChatSessionVO session(String id) {
        return session(id, null);
    }

    private static ChatSessionVO session(String id, String cityName) {
        ChatSessionVO vo = new ChatSessionVO();
        vo.setId(id);
        vo.setCityName(cityName);
        vo.setSessionContext(new SessionContext());
        return vo;
    }

    private static GenerationResult cityResult() {
        GeneralCityData data = new GeneralCityData();
        data.setCity("Lisbon");
        GenerationResult result = GenerationResult.success(GenerationTask.CITY_DATA);
        result.setCityData(data);
        result.setRawText("{\"city\": \"Lisbon\"}");
        return result;
    }

    private static GenerationResult diningResult() {
        PoiDetailedInfo poi = new PoiDetailedInfo();
        poi.setName("Cervejaria Ramiro");
        GenerationResult result = GenerationResult.success(GenerationTask.DINING);
        result.setPois(List.of(poi));
        result.setRawText("{\"restaurants\": [{\"name\": \"Cervejaria Ramiro\"}]}");
        return result;
    }
}
