package com.loci.server.controller;

import com.loci.common.constant.RedisConstants;
import com.loci.common.context.BaseContext;
import com.loci.common.exception.BaseException;
import com.loci.common.properties.ChatProperties;
import com.loci.common.result.ErrorCode;
import com.loci.common.result.Result;
import com.loci.pojo.dto.CityBundleRequestDTO;
import com.loci.pojo.dto.SessionCreateDTO;
import com.loci.pojo.dto.UnifiedChatRequestDTO;
import com.loci.pojo.entity.LlmSuggestedPoi;
import com.loci.pojo.entity.PointOfInterest;
import com.loci.pojo.vo.ChatSessionVO;
import com.loci.pojo.vo.CityBundleVO;
import com.loci.server.ai.orchestrator.CityBundleOrchestrator;
import com.loci.server.limit.SimpleRateLimiter;
import com.loci.server.service.ChatSessionService;
import com.loci.server.service.PoiService;
import com.loci.server.stream.SseStreamBridge;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Objects;

/**
 * 对话与推荐接口。调用方身份来自网关写入的 X-User-Id，由 UserIdentityInterceptor 放入 BaseContext。
 */
@RestController
@RequestMapping("/chat")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "chat", description = "城市推荐、流式对话与会话")
public class ChatController {

    private final CityBundleOrchestrator cityBundleOrchestrator;
    private final SseStreamBridge sseStreamBridge;
    private final PoiService poiService;
    private final ChatSessionService chatSessionService;
    private final SimpleRateLimiter simpleRateLimiter;
    private final ChatProperties chatProperties;

    /**
     * 城市数据、通用 POI、个性化 POI 三路并行生成，并按需落库。
     */
    @PostMapping("/city-bundle")
    @Operation(summary = "生成城市推荐包")
    public Result<CityBundleVO> cityBundle(@RequestBody CityBundleRequestDTO dto) {
        Long userId = BaseContext.getCurrentId();
        if (dto == null || !StringUtils.hasText(dto.getCityName())) {
            return Result.error(ErrorCode.INVALID_PARAM.getCode(), "cityName 不能为空");
        }
        if (!acquire(userId)) {
            return Result.error(ErrorCode.TOO_FREQUENT);
        }
        dto.setUserId(userId);
        log.info("城市推荐请求: userId={}, cityName={}, persist={}", userId, dto.getCityName(), dto.getPersist());
        try {
            return Result.success(cityBundleOrchestrator.generateAndPersist(dto));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("城市推荐请求被中断: userId={}, cityName={}", userId, dto.getCityName());
            return Result.error(ErrorCode.AI_CALL_FAILED.getCode(), "request was interrupted");
        }
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "统一流式对话（SSE）")
    public SseEmitter stream(@RequestBody UnifiedChatRequestDTO dto) {
        Long userId = BaseContext.getCurrentId();
        if (dto == null || !StringUtils.hasText(dto.getMessage())) {
            return sseStreamBridge.rejected("request", "message 不能为空");
        }
        if (!acquire(userId)) {
            return sseStreamBridge.rejected("request", ErrorCode.TOO_FREQUENT.getMsg());
        }
        log.info("流式对话请求: userId={}, sessionId={}, cityName={}", userId, dto.getSessionId(), dto.getCityName());
        return sseStreamBridge.open(dto, userId);
    }

    @GetMapping("/pois/suggested")
    @Operation(summary = "按距离排序的建议 POI")
    public Result<List<LlmSuggestedPoi>> suggestedPois(@RequestParam Long interactionId,
                                                       @RequestParam(required = false) Long cityId,
                                                       @RequestParam double lat,
                                                       @RequestParam double lon) {
        return Result.success(poiService.listSuggestedPoisByDistance(interactionId, cityId, lat, lon));
    }

    @GetMapping("/pois/city")
    @Operation(summary = "按距离排序的城市 POI")
    public Result<List<PointOfInterest>> cityPois(@RequestParam Long cityId,
                                                  @RequestParam double lat,
                                                  @RequestParam double lon) {
        return Result.success(poiService.listCityPoisByDistance(cityId, lat, lon));
    }

    @PostMapping("/sessions")
    @Operation(summary = "新建会话")
    public Result<ChatSessionVO> createSession(@RequestBody(required = false) SessionCreateDTO dto) {
        Long userId = BaseContext.getCurrentId();
        Long profileId = dto == null ? null : dto.getProfileId();
        String cityName = dto == null ? null : dto.getCityName();
        return Result.success(chatSessionService.createSession(userId, profileId, cityName));
    }

    @GetMapping("/sessions/{id}")
    @Operation(summary = "查询会话")
    public Result<ChatSessionVO> getSession(@PathVariable("id") String id) {
        ChatSessionVO session = chatSessionService.getSession(id);
        // 只能查看自己的会话
        if (!Objects.equals(session.getUserId(), BaseContext.getCurrentId())) {
            throw new BaseException(ErrorCode.SESSION_NOT_FOUND);
        }
        return Result.success(session);
    }

    private boolean acquire(Long userId) {
        return simpleRateLimiter.tryAcquire(RedisConstants.RATE_LIMIT_CHAT_USER, String.valueOf(userId),
                chatProperties.getRateLimitWindowSeconds(), chatProperties.getRateLimitMaxRequests());
    }
}
