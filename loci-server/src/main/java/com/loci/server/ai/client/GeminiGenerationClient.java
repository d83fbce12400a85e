package com.loci.server.ai.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loci.common.exception.GenerationException;
import com.loci.common.properties.AiProperties;
import com.loci.common.result.ErrorCode;
import com.loci.server.metrics.MetricsRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Gemini generateContent REST 客户端：基于 JDK HttpClient 收发 JSON，不依赖 SDK。
 *
 * 请求通过 sendAsync 发出并在调用线程上等待，调用线程被中断时取消底层请求。
 */
@Component
@Slf4j
public class GeminiGenerationClient implements GenerationClient {

    private final AiProperties aiProperties;
    private final ObjectMapper objectMapper;
    private final HttpClient aiHttpClient;
    private final MetricsRecorder metricsRecorder;

    public GeminiGenerationClient(AiProperties aiProperties,
                                  ObjectMapper objectMapper,
                                  HttpClient aiHttpClient,
                                  MetricsRecorder metricsRecorder) {
        this.aiProperties = aiProperties;
        this.objectMapper = objectMapper;
        this.aiHttpClient = aiHttpClient;
        this.metricsRecorder = metricsRecorder;
    }

    @Override
    public GenerateContentResponse generateResponse(String prompt, GenerationConfig config) throws InterruptedException {
        GenerationConfig cfg = config == null ? GenerationConfig.defaults() : config;
        String model = StringUtils.hasText(cfg.getModel()) ? cfg.getModel() : aiProperties.getModel();
        if (!StringUtils.hasText(aiProperties.getBaseUrl())
                || !StringUtils.hasText(aiProperties.getApiKey())
                || !StringUtils.hasText(model)) {
            log.warn("AI 配置不完整，跳过外部 LLM 调用");
            metricsRecorder.recordGenerationCall("skipped", "config_missing", model);
            throw new GenerationException(ErrorCode.AI_CONFIG_MISSING, "generation client is not configured");
        }

        long startNs = System.nanoTime();
        int promptBytes = safeBytes(prompt);
        int maxAttempts = 1 + Math.max(0, aiProperties.getMaxRetries());
        GeminiHttpResult last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            last = doHttpCall(model, prompt, cfg);
            if (last.success) {
                long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
                metricsRecorder.recordGenerationLatencyMs(latencyMs, "success", model);
                metricsRecorder.recordGenerationCall("success", "ok", model);
                log.info("AI generate success: model={}, latencyMs={}, attempts={}, promptBytes={}, respBytes={}",
                        model, latencyMs, attempt, promptBytes, last.responseBytes);
                last.response.setModelVersion(model);
                return last.response;
            }
            if (!isRetriable(last.statusCode, last.errorType)) {
                break;
            }
            if (attempt < maxAttempts) {
                log.debug("AI generate retry: model={}, attempt={}, errorType={}", model, attempt, last.errorType);
            }
        }

        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        metricsRecorder.recordGenerationLatencyMs(latencyMs, "fail", model);
        metricsRecorder.recordGenerationCall("fail", last.errorType, model);
        log.warn("AI generate fail: model={}, latencyMs={}, statusCode={}, errorType={}, promptBytes={}, respBytes={}",
                model, latencyMs, last.statusCode, last.errorType, promptBytes, last.responseBytes);
        throw new GenerationException(ErrorCode.AI_CALL_FAILED,
                "generation call failed: status=" + last.statusCode + ", error=" + last.errorType, last.cause);
    }

    private GeminiHttpResult doHttpCall(String model, String prompt, GenerationConfig cfg) throws InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint(model)))
                    .timeout(Duration.ofMillis(Math.max(1, aiProperties.getRequestTimeoutMs())))
                    .header("Content-Type", "application/json")
                    .header("x-goog-api-key", aiProperties.getApiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(buildBody(prompt, cfg))))
                    .build();
        } catch (Exception e) {
            return GeminiHttpResult.fail(0, "bad_request", 0, e);
        }

        CompletableFuture<HttpResponse<String>> future =
                aiHttpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> response;
        try {
            response = future.get();
        } catch (InterruptedException ie) {
            future.cancel(true);
            log.info("AI generate cancelled: model={}", model);
            metricsRecorder.recordGenerationCall("cancelled", "interrupted", model);
            throw ie;
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof HttpTimeoutException) {
                return GeminiHttpResult.fail(0, "timeout", 0, cause);
            }
            return GeminiHttpResult.fail(0, "io_exception", 0, cause);
        }

        int code = response.statusCode();
        String respBody = response.body();
        int respBytes = safeBytes(respBody);
        if (code / 100 != 2 || !StringUtils.hasText(respBody)) {
            return GeminiHttpResult.fail(code, "http_" + code, respBytes, null);
        }
        try {
            GenerateContentResponse parsed = objectMapper.readValue(respBody, GenerateContentResponse.class);
            if (parsed.getCandidates() == null || parsed.getCandidates().isEmpty()) {
                return GeminiHttpResult.fail(code, "bad_response_no_candidates", respBytes, null);
            }
            return GeminiHttpResult.ok(parsed, respBytes);
        } catch (Exception e) {
            return GeminiHttpResult.fail(code, "bad_response_json", respBytes, e);
        }
    }

    private Map<String, Object> buildBody(String prompt, GenerationConfig cfg) {
        Map<String, Object> part = new HashMap<>();
        part.put("text", prompt);
        Map<String, Object> content = new HashMap<>();
        content.put("role", "user");
        content.put("parts", List.of(part));

        Map<String, Object> generationConfig = new HashMap<>();
        float temperature = cfg.getTemperature() != null ? cfg.getTemperature() : aiProperties.getTemperature();
        generationConfig.put("temperature", temperature);
        int maxTokens = cfg.getMaxOutputTokens() != null ? cfg.getMaxOutputTokens() : aiProperties.getMaxOutputTokens();
        if (maxTokens > 0) {
            generationConfig.put("maxOutputTokens", maxTokens);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("contents", List.of(content));
        body.put("generationConfig", generationConfig);
        return body;
    }

    private String endpoint(String model) {
        String base = aiProperties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/models/" + model + ":generateContent";
    }

    private boolean isRetriable(int statusCode, String errorType) {
        if ("timeout".equals(errorType)) {
            return true;
        }
        if (statusCode == 429) {
            return true;
        }
        return statusCode / 100 == 5;
    }

    private int safeBytes(String s) {
        if (!StringUtils.hasText(s)) {
            return 0;
        }
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    private static class GeminiHttpResult {
        private final boolean success;
        private final GenerateContentResponse response;
        private final int statusCode;
        private final String errorType;
        private final int responseBytes;
        private final Throwable cause;

        private GeminiHttpResult(boolean success, GenerateContentResponse response, int statusCode,
                                 String errorType, int responseBytes, Throwable cause) {
            this.success = success;
            this.response = response;
            this.statusCode = statusCode;
            this.errorType = errorType;
            this.responseBytes = responseBytes;
            this.cause = cause;
        }

        static GeminiHttpResult ok(GenerateContentResponse response, int responseBytes) {
            return new GeminiHttpResult(true, response, 200, "ok", responseBytes, null);
        }

        static GeminiHttpResult fail(int statusCode, String errorType, int responseBytes, Throwable cause) {
            return new GeminiHttpResult(false, null, statusCode, errorType, responseBytes, cause);
        }
    }
}
