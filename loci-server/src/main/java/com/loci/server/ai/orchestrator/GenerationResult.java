package com.loci.server.ai.orchestrator;

import com.loci.pojo.ai.GeneralCityData;
import com.loci.pojo.ai.ItineraryResponse;
import com.loci.pojo.ai.PoiDetailedInfo;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个生成任务的结果：要么带负载，要么带错误信息。
 */
@Getter
@Setter
public class GenerationResult {

    private final GenerationTask task;

    private final boolean success;

    private final String error;

    private GeneralCityData cityData;

    private List<PoiDetailedInfo> pois = new ArrayList<>();

    private ItineraryResponse itinerary;

    private Long llmInteractionId;

    /** 清洗后的模型输出 */
    private String rawText;

    private Integer promptTokens;

    private Integer completionTokens;

    private Integer totalTokens;

    private long latencyMs;

    private GenerationResult(GenerationTask task, boolean success, String error) {
        this.task = task;
        this.success = success;
        this.error = error;
    }

    public static GenerationResult success(GenerationTask task) {
        return new GenerationResult(task, true, null);
    }

    public static GenerationResult failure(GenerationTask task, String error) {
        return new GenerationResult(task, false, error == null ? "unknown error" : error);
    }

    @Override
    public String toString() {
        return "GenerationResult{task=" + task + ", success=" + success
                + (success ? ", pois=" + pois.size() : ", error=" + error) + "}";
    }
}
