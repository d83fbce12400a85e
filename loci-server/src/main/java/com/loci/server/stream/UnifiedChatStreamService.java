package com.loci.server.stream;

import com.loci.common.constant.ChatConstants;
import com.loci.common.exception.BaseException;
import com.loci.common.properties.AiProperties;
import com.loci.common.result.ErrorCode;
import com.loci.pojo.ai.ItineraryResponse;
import com.loci.pojo.dto.CityBundleRequestDTO;
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
import com.loci.server.classifier.Classification;
import com.loci.server.classifier.MessageClassifier;
import com.loci.server.service.ChatSessionService;
import com.loci.server.service.LlmInteractionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * 统一对话流水线：分类 -> 会话 -> 按领域并行生成 -> 流式推送 -> 交互落库 -> 会话更新。
 *
 * 事件顺序：start、classification，然后各任务的 city_data / chunk / part_complete / error
 * （按完成先后），最后 complete。调用方负责关闭 sink。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UnifiedChatStreamService {

    public static final String PART_SESSION = "session";
    public static final String PART_PERSISTENCE = "persistence";
    public static final String PART_PIPELINE = "pipeline";

    private final MessageClassifier messageClassifier;
    private final ChatSessionService chatSessionService;
    private final GenerationWorkers generationWorkers;
    private final ParallelGenerationRunner parallelGenerationRunner;
    private final LlmInteractionService llmInteractionService;
    private final GenerationCache generationCache;
    private final AiProperties aiProperties;

    /**
     * @return 本次对话所在的会话 ID
     */
    public String process(UnifiedChatRequestDTO request, Long userId, StreamEventSink sink)
            throws InterruptedException {
        if (request == null || !StringUtils.hasText(request.getMessage())) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "message is required");
        }
        long start = System.currentTimeMillis();
        String message = request.getMessage().trim();
        Classification classification = messageClassifier.classify(message);
        ChatDomain domain = classification.getDomain();
        ChatIntent intent = classification.getIntent();

        ChatSessionVO session = resolveSession(request, userId);
        String cityName = StringUtils.hasText(request.getCityName())
                ? request.getCityName().trim() : session.getCityName();
        if (!StringUtils.hasText(cityName)) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "cityName is required for a new conversation");
        }
        String sessionId = session.getId();

        Map<String, Object> startData = new LinkedHashMap<>();
        startData.put("sessionId", sessionId);
        startData.put("cityName", cityName);
        sink.send(StreamEventVO.of(StreamEventVO.TYPE_START, PART_SESSION, startData));
        sink.send(StreamEventVO.of(StreamEventVO.TYPE_CLASSIFICATION, PART_SESSION, classification));
        log.info("统一对话开始: sessionId={}, domain={}, intent={}, cityName={}",
                sessionId, domain.getCode(), intent.getCode(), cityName);

        chatSessionService.appendMessage(sessionId, ConversationMessage.user(message, domain.getCode()));

        String cacheKey = GenerationCache.cacheKey(domain, cityName, message, request.getPreferences());
        CachedChatReply cached = generationCache.get(cacheKey);
        Long interactionId = null;
        CachedChatReply reply;
        if (cached != null) {
            log.info("命中生成缓存，回放事件: sessionId={}, key={}", sessionId, cacheKey);
            replay(cached, sink);
            reply = cached;
        } else {
            Map<GenerationTask, GenerationResult> results = generate(request, userId, sessionId, cityName, domain, sink);
            reply = toReply(domain, cityName, results);
            if (results.values().stream().noneMatch(GenerationResult::isSuccess)) {
                sink.send(StreamEventVO.error(PART_PIPELINE, "all generation tasks failed"));
                sink.send(StreamEventVO.of(StreamEventVO.TYPE_COMPLETE, PART_PIPELINE, completeData(sessionId, null, domain)));
                return sessionId;
            }
            interactionId = saveInteraction(userId, sessionId, cityName, domain, message, reply,
                    System.currentTimeMillis() - start, sink);
            generationCache.put(cacheKey, reply);
        }

        chatSessionService.appendMessage(sessionId, ConversationMessage.assistant(reply.getResponseText(), domain.getCode()));
        ItineraryResponse itinerary = reply.getItinerary() != null ? reply.getItinerary() : session.getCurrentItinerary();
        chatSessionService.updateSessionState(sessionId, cityName, itinerary,
                nextContext(session.getSessionContext(), domain, intent, request.getPreferences()));

        sink.send(StreamEventVO.of(StreamEventVO.TYPE_COMPLETE, PART_PIPELINE, completeData(sessionId, interactionId, domain)));
        log.info("统一对话结束: sessionId={}, interactionId={}, costMs={}", sessionId, interactionId,
                System.currentTimeMillis() - start);
        return sessionId;
    }

    private ChatSessionVO resolveSession(UnifiedChatRequestDTO request, Long userId) {
        if (StringUtils.hasText(request.getSessionId())) {
            return chatSessionService.getSession(request.getSessionId());
        }
        if (!StringUtils.hasText(request.getCityName())) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "cityName is required for a new conversation");
        }
        return chatSessionService.createSession(userId, request.getProfileId(), request.getCityName().trim());
    }

    private Map<GenerationTask, GenerationResult> generate(UnifiedChatRequestDTO request, Long userId, String sessionId,
                                                          String cityName, ChatDomain domain, StreamEventSink sink)
            throws InterruptedException {
        Map<GenerationTask, Callable<GenerationResult>> tasks = new LinkedHashMap<>();
        tasks.put(GenerationTask.CITY_DATA, () -> generationWorkers.cityData(cityName));
        if (domain.isDomainSpecific()) {
            GenerationTask task = GenerationTask.forDomain(domain);
            tasks.put(task, () -> generationWorkers.domainPois(domain, cityName, request.getUserLatitude(),
                    request.getUserLongitude(), request.getPreferences()));
        } else {
            CityBundleRequestDTO bundleRequest = new CityBundleRequestDTO();
            bundleRequest.setCityName(cityName);
            bundleRequest.setUserId(userId);
            bundleRequest.setProfileId(request.getProfileId());
            bundleRequest.setSessionId(sessionId);
            bundleRequest.setPreferences(request.getPreferences());
            bundleRequest.setUserLatitude(request.getUserLatitude());
            bundleRequest.setUserLongitude(request.getUserLongitude());
            tasks.put(GenerationTask.GENERAL_POIS, () -> generationWorkers.generalPois(cityName));
            tasks.put(GenerationTask.PERSONALIZED_POIS, () -> generationWorkers.personalizedPois(bundleRequest, false));
        }
        return parallelGenerationRunner.runAll(tasks, result -> emit(result, sink));
    }

    static void emit(GenerationResult result, StreamEventSink sink) {
        String part = result.getTask().getCode();
        if (!result.isSuccess()) {
            sink.send(StreamEventVO.error(part, result.getError()));
            return;
        }
        if (result.getTask() == GenerationTask.CITY_DATA) {
            sink.send(StreamEventVO.of(StreamEventVO.TYPE_CITY_DATA, part, result.getCityData()));
        } else if (result.getTask() == GenerationTask.PERSONALIZED_POIS) {
            sink.send(StreamEventVO.of(StreamEventVO.TYPE_CHUNK, part, result.getItinerary()));
        } else {
            sink.send(StreamEventVO.of(StreamEventVO.TYPE_CHUNK, part, result.getPois()));
        }
        sink.send(StreamEventVO.of(StreamEventVO.TYPE_PART_COMPLETE, part, null));
    }

    private void replay(CachedChatReply cached, StreamEventSink sink) {
        if (cached.getCityData() != null) {
            GenerationResult city = GenerationResult.success(GenerationTask.CITY_DATA);
            city.setCityData(cached.getCityData());
            emit(city, sink);
        }
        GenerationTask poiTask = cached.getDomain() != null && cached.getDomain().isDomainSpecific()
                ? GenerationTask.forDomain(cached.getDomain()) : GenerationTask.GENERAL_POIS;
        GenerationResult pois = GenerationResult.success(poiTask);
        pois.setPois(cached.getPois());
        emit(pois, sink);
        if (cached.getItinerary() != null) {
            GenerationResult itinerary = GenerationResult.success(GenerationTask.PERSONALIZED_POIS);
            itinerary.setItinerary(cached.getItinerary());
            emit(itinerary, sink);
        }
    }

    static CachedChatReply toReply(ChatDomain domain, String cityName, Map<GenerationTask, GenerationResult> results) {
        CachedChatReply reply = new CachedChatReply();
        reply.setDomain(domain);
        reply.setCityName(cityName);
        GenerationResult city = results.get(GenerationTask.CITY_DATA);
        if (city != null && city.isSuccess()) {
            reply.setCityData(city.getCityData());
        }
        GenerationTask poiTask = domain.isDomainSpecific() ? GenerationTask.forDomain(domain) : GenerationTask.GENERAL_POIS;
        GenerationResult pois = results.get(poiTask);
        if (pois != null && pois.isSuccess()) {
            reply.setPois(pois.getPois());
            reply.setResponseText(pois.getRawText());
        }
        GenerationResult personalized = results.get(GenerationTask.PERSONALIZED_POIS);
        if (personalized != null && personalized.isSuccess()) {
            reply.setItinerary(personalized.getItinerary());
            reply.setResponseText(personalized.getRawText());
        }
        if (reply.getResponseText() == null && city != null && city.isSuccess()) {
            reply.setResponseText(city.getRawText());
        }
        return reply;
    }

    /**
     * 交互落库失败只推送 error 事件，不中断对话。
     */
    private Long saveInteraction(Long userId, String sessionId, String cityName, ChatDomain domain, String message,
                                 CachedChatReply reply, long latencyMs, StreamEventSink sink) {
        LlmInteraction interaction = new LlmInteraction();
        interaction.setUserId(userId);
        interaction.setSessionId(sessionId);
        interaction.setCityName(cityName);
        interaction.setPrompt(String.format(ChatConstants.UNIFIED_CHAT_PROMPT_FORMAT, domain.getCode(), message));
        interaction.setResponse(reply.getResponseText());
        interaction.setModelName(StringUtils.hasText(aiProperties.getModel())
                ? aiProperties.getModel() : ChatConstants.DEFAULT_MODEL);
        interaction.setLatencyMs(latencyMs);
        interaction.setDomain(domain);
        try {
            return llmInteractionService.saveInteraction(interaction);
        } catch (RuntimeException e) {
            log.error("统一对话交互落库失败: sessionId={}, error={}", sessionId, e.getMessage(), e);
            sink.send(StreamEventVO.error(PART_PERSISTENCE, e.getMessage()));
            return null;
        }
    }

    static SessionContext nextContext(SessionContext previous, ChatDomain domain, ChatIntent intent, String preferences) {
        SessionContext context = previous == null ? new SessionContext() : previous;
        context.setLastDomain(domain.getCode());
        context.setLastIntent(intent.getCode());
        if (StringUtils.hasText(preferences)) {
            context.setPreferences(preferences.trim());
        }
        if (context.getModificationHistory() == null) {
            context.setModificationHistory(new ArrayList<>());
        }
        if (intent != ChatIntent.ASK_QUESTION) {
            context.getModificationHistory().add(intent.getCode() + ":" + domain.getCode());
        }
        return context;
    }

    private static Map<String, Object> completeData(String sessionId, Long interactionId, ChatDomain domain) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", sessionId);
        data.put("llmInteractionId", interactionId);
        data.put("domain", domain.getCode());
        return data;
    }
}
