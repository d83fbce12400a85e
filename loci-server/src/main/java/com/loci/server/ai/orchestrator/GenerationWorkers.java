package com.loci.server.ai.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loci.common.constant.ChatConstants;
import com.loci.common.properties.AiProperties;
import com.loci.pojo.ai.GeneralCityData;
import com.loci.pojo.ai.ItineraryResponse;
import com.loci.pojo.ai.PoiCollectionResponse;
import com.loci.pojo.ai.PoiDetailedInfo;
import com.loci.pojo.dto.CityBundleRequestDTO;
import com.loci.pojo.entity.LlmInteraction;
import com.loci.pojo.enums.ChatDomain;
import com.loci.server.ai.client.GenerateContentResponse;
import com.loci.server.ai.client.GenerationClient;
import com.loci.server.ai.client.GenerationConfig;
import com.loci.server.ai.normalizer.PoiResponseParser;
import com.loci.server.ai.normalizer.ResponseCleaner;
import com.loci.server.ai.prompt.PromptTemplates;
import com.loci.server.metrics.MetricsRecorder;
import com.loci.server.service.LlmInteractionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 各生成任务的工作单元：拼提示词 -> 调模型 -> 取首个候选文本 -> 清洗 -> 解码。
 *
 * 除线程中断外，所有异常都收敛成失败结果返回，不向外抛。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenerationWorkers {

    private final GenerationClient generationClient;
    private final ObjectMapper objectMapper;
    private final PoiResponseParser poiResponseParser;
    private final LlmInteractionService llmInteractionService;
    private final MetricsRecorder metricsRecorder;
    private final AiProperties aiProperties;

    public GenerationResult cityData(String cityName) throws InterruptedException {
        GenerationTask task = GenerationTask.CITY_DATA;
        return run(task, PromptTemplates.cityData(cityName), GenerationConfig.defaults(), (result, text) -> {
            GeneralCityData data = objectMapper.readValue(text, GeneralCityData.class);
            if (!StringUtils.hasText(data.getCity())) {
                data.setCity(cityName);
            }
            result.setCityData(data);
        });
    }

    public GenerationResult generalPois(String cityName) throws InterruptedException {
        GenerationTask task = GenerationTask.GENERAL_POIS;
        return run(task, PromptTemplates.generalPois(cityName), GenerationConfig.defaults(), (result, text) -> {
            PoiCollectionResponse collection = objectMapper.readValue(text, PoiCollectionResponse.class);
            result.setPois(nonNull(collection.getPointsOfInterest()));
        });
    }

    /**
     * 个性化行程。recordInteraction 为 true 时在本线程独立事务中写入交互记录，写入失败视为任务失败。
     */
    public GenerationResult personalizedPois(CityBundleRequestDTO request, boolean recordInteraction)
            throws InterruptedException {
        GenerationTask task = GenerationTask.PERSONALIZED_POIS;
        String prompt = PromptTemplates.personalizedItinerary(request.getCityName(), request.getInterests(),
                request.getTags(), request.getPreferences());
        GenerationResult result = run(task, prompt, GenerationConfig.defaults(), (r, text) -> {
            ItineraryResponse itinerary = objectMapper.readValue(text, ItineraryResponse.class);
            r.setItinerary(itinerary);
            r.setPois(nonNull(itinerary.getPointsOfInterest()));
        });
        if (!result.isSuccess() || !recordInteraction) {
            return result;
        }
        try {
            Long interactionId = llmInteractionService.saveInteraction(toInteraction(request, prompt, result));
            result.setLlmInteractionId(interactionId);
            return result;
        } catch (RuntimeException e) {
            log.error("个性化交互落库失败: cityName={}, error={}", request.getCityName(), e.getMessage(), e);
            metricsRecorder.recordWorkerResult(task.getCode() + "_save", false);
            return GenerationResult.failure(task, "failed to save personalized interaction: " + e.getMessage());
        }
    }

    /**
     * 住宿 / 餐饮 / 活动推荐，POI 由 PoiResponseParser 统一解析。
     */
    public GenerationResult domainPois(ChatDomain domain, String cityName, Double latitude, Double longitude,
                                       String preferences) throws InterruptedException {
        GenerationTask task = GenerationTask.forDomain(domain);
        if (task == null) {
            throw new IllegalArgumentException("not a domain specific chat domain: " + domain);
        }
        String prompt;
        switch (task) {
            case DINING:
                prompt = PromptTemplates.dining(cityName, latitude, longitude, preferences);
                break;
            case ACCOMMODATION:
                prompt = PromptTemplates.accommodation(cityName, latitude, longitude, preferences);
                break;
            default:
                prompt = PromptTemplates.activities(cityName, latitude, longitude, preferences);
                break;
        }
        return run(task, prompt, GenerationConfig.defaults(), (result, text) -> {
            List<PoiDetailedInfo> pois = poiResponseParser.parse(text);
            if (pois.isEmpty()) {
                throw new IllegalStateException("no " + task.getLabel() + " items found in AI response");
            }
            result.setPois(pois);
        });
    }

    private GenerationResult run(GenerationTask task, String prompt, GenerationConfig config, Decoder decoder)
            throws InterruptedException {
        long startNs = System.nanoTime();
        GenerationResult result;
        try {
            GenerateContentResponse response = generationClient.generateResponse(prompt, config);
            String text = response == null ? null : response.firstText();
            if (!StringUtils.hasText(text)) {
                result = GenerationResult.failure(task, "no valid " + task.getLabel() + " content from AI");
            } else {
                String cleaned = ResponseCleaner.cleanJson(text);
                result = GenerationResult.success(task);
                result.setRawText(cleaned);
                decoder.decode(result, cleaned);
                copyUsage(response, result);
            }
        } catch (InterruptedException e) {
            throw e;
        } catch (JsonProcessingException e) {
            log.warn("{} 响应 JSON 解析失败: {}", task.getCode(), e.getOriginalMessage());
            result = GenerationResult.failure(task, "failed to decode " + task.getLabel() + " JSON: "
                    + e.getOriginalMessage());
        } catch (Exception e) {
            log.warn("{} 生成失败: {}", task.getCode(), e.getMessage());
            result = GenerationResult.failure(task, e.getMessage());
        }
        result.setLatencyMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs));
        metricsRecorder.recordWorkerResult(task.getCode(), result.isSuccess());
        log.info("生成任务结束: task={}, success={}, latencyMs={}", task.getCode(), result.isSuccess(),
                result.getLatencyMs());
        return result;
    }

    private LlmInteraction toInteraction(CityBundleRequestDTO request, String prompt, GenerationResult result) {
        LlmInteraction interaction = new LlmInteraction();
        interaction.setUserId(request.getUserId());
        interaction.setSessionId(request.getSessionId());
        interaction.setCityName(request.getCityName());
        interaction.setPrompt(prompt);
        interaction.setResponse(result.getRawText());
        interaction.setModelName(StringUtils.hasText(aiProperties.getModel())
                ? aiProperties.getModel() : ChatConstants.DEFAULT_MODEL);
        interaction.setPromptTokens(result.getPromptTokens());
        interaction.setCompletionTokens(result.getCompletionTokens());
        interaction.setTotalTokens(result.getTotalTokens());
        interaction.setLatencyMs(result.getLatencyMs());
        interaction.setDomain(ChatDomain.ITINERARY);
        return interaction;
    }

    private static void copyUsage(GenerateContentResponse response, GenerationResult result) {
        GenerateContentResponse.UsageMetadata usage = response.getUsageMetadata();
        if (usage == null) {
            return;
        }
        result.setPromptTokens(usage.getPromptTokenCount());
        result.setCompletionTokens(usage.getCandidatesTokenCount());
        result.setTotalTokens(usage.getTotalTokenCount());
    }

    private static List<PoiDetailedInfo> nonNull(List<PoiDetailedInfo> pois) {
        return pois == null ? new ArrayList<>() : pois;
    }

    @FunctionalInterface
    private interface Decoder {
        void decode(GenerationResult result, String cleanedText) throws Exception;
    }
}
