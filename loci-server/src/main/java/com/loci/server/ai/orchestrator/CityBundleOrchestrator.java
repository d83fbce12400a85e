package com.loci.server.ai.orchestrator;

import com.loci.common.exception.BaseException;
import com.loci.common.exception.GenerationException;
import com.loci.common.result.ErrorCode;
import com.loci.pojo.dto.CityBundleRequestDTO;
import com.loci.pojo.vo.CityBundleVO;
import com.loci.server.service.CityBundlePersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * 城市数据 / 通用 POI / 个性化 POI 三路并行生成并合并。
 *
 * 一路失败只记录到 errors，不影响其它两路；三路全部失败时整体抛 GenerationException。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CityBundleOrchestrator {

    private final GenerationWorkers generationWorkers;
    private final ParallelGenerationRunner parallelGenerationRunner;
    private final CityBundlePersistenceService cityBundlePersistenceService;

    public CityBundleVO generate(CityBundleRequestDTO request) throws InterruptedException {
        if (request == null || !StringUtils.hasText(request.getCityName())) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "cityName is required");
        }
        String cityName = request.getCityName().trim();
        request.setCityName(cityName);

        Map<GenerationTask, Callable<GenerationResult>> tasks = new LinkedHashMap<>();
        tasks.put(GenerationTask.CITY_DATA, () -> generationWorkers.cityData(cityName));
        tasks.put(GenerationTask.GENERAL_POIS, () -> generationWorkers.generalPois(cityName));
        tasks.put(GenerationTask.PERSONALIZED_POIS, () -> generationWorkers.personalizedPois(request, true));

        long start = System.currentTimeMillis();
        Map<GenerationTask, GenerationResult> results = parallelGenerationRunner.runAll(tasks);
        CityBundleVO bundle = merge(cityName, results.values());
        log.info("城市生成完成: cityName={}, costMs={}, errors={}", cityName,
                System.currentTimeMillis() - start, bundle.getErrors().keySet());
        return bundle;
    }

    /**
     * 生成后落库：城市、通用 POI、个性化建议 POI 与行程，并按距离排序建议 POI。
     */
    public CityBundleVO generateAndPersist(CityBundleRequestDTO request) throws InterruptedException {
        CityBundleVO bundle = generate(request);
        if (!Boolean.FALSE.equals(request.getPersist())) {
            cityBundlePersistenceService.persist(request, bundle);
        }
        return bundle;
    }

    static CityBundleVO merge(String cityName, Collection<GenerationResult> results) {
        CityBundleVO bundle = new CityBundleVO();
        bundle.setCityName(cityName);
        boolean anySuccess = false;
        for (GenerationResult result : results) {
            if (!result.isSuccess()) {
                bundle.getErrors().put(result.getTask().getCode(), result.getError());
                continue;
            }
            anySuccess = true;
            switch (result.getTask()) {
                case CITY_DATA:
                    bundle.setCityData(result.getCityData());
                    break;
                case GENERAL_POIS:
                    bundle.setGeneralPois(result.getPois());
                    break;
                case PERSONALIZED_POIS:
                    if (result.getItinerary() != null) {
                        bundle.setItineraryName(result.getItinerary().getItineraryName());
                        bundle.setOverallDescription(result.getItinerary().getOverallDescription());
                    }
                    bundle.setPersonalizedPois(result.getPois());
                    bundle.setLlmInteractionId(result.getLlmInteractionId());
                    break;
                default:
                    log.debug("城市生成忽略非预期任务结果: task={}", result.getTask());
                    break;
            }
        }
        if (!anySuccess && !results.isEmpty()) {
            String detail = bundle.getErrors().entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining("; "));
            throw new GenerationException(ErrorCode.AI_ALL_TASKS_FAILED, "all generation tasks failed: " + detail);
        }
        return bundle;
    }
}
