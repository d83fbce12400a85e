package com.loci.server.ai.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loci.common.exception.GenerationException;
import com.loci.common.properties.AiProperties;
import com.loci.common.result.ErrorCode;
import com.loci.server.metrics.MetricsRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 用 Mockito 模拟 HttpClient，不发真实请求。
 */
@ExtendWith(MockitoExtension.class)
class GeminiGenerationClientTest {

    private static final String OK_BODY = "{\"candidates\": [{\"content\": {\"role\": \"model\","
            + " \"parts\": [{\"text\": \"{\\\"city\\\": \\\"Lisbon\\\"}\"}]}}],"
            + " \"usageMetadata\": {\"promptTokenCount\": 3, \"candidatesTokenCount\": 5, \"totalTokenCount\": 8}}";

    @Mock
    private HttpClient httpClient;

    @Mock
    private MetricsRecorder metricsRecorder;

    private AiProperties aiProperties;
    private GeminiGenerationClient client;

    @BeforeEach
    void setUp() {
        aiProperties = new AiProperties();
        aiProperties.setBaseUrl("https://llm.example.test/v1beta/");
        aiProperties.setApiKey("test-key");
        aiProperties.setModel("gemini-2.0-flash");
        aiProperties.setMaxRetries(1);
        client = new GeminiGenerationClient(aiProperties, new ObjectMapper(), httpClient, metricsRecorder);
    }

    @Test
    void generateResponse_shouldFailFast_whenNotConfigured() {
        aiProperties.setApiKey("");

        GenerationException ex = assertThrows(GenerationException.class,
                () -> client.generateResponse("hi", GenerationConfig.defaults()));

        assertEquals(ErrorCode.AI_CONFIG_MISSING.getCode(), ex.getCode().intValue());
        verifyNoInteractions(httpClient);
    }

    @Test
    void generateResponse_shouldParseCandidates() throws Exception {
        HttpResponse<String> ok = response(200, OK_BODY);
        when(httpClient.<String>sendAsync(any(HttpRequest.class), any())).thenReturn(CompletableFuture.completedFuture(ok));

        GenerateContentResponse response = client.generateResponse("describe Lisbon", GenerationConfig.defaults());

        assertEquals("{\"city\": \"Lisbon\"}", response.firstText());
        assertEquals(8, response.getUsageMetadata().getTotalTokenCount());
        assertEquals("gemini-2.0-flash", response.getModelVersion());

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).sendAsync(request.capture(), any());
        assertEquals("https://llm.example.test/v1beta/models/gemini-2.0-flash:generateContent",
                request.getValue().uri().toString());
        assertEquals("test-key", request.getValue().headers().firstValue("x-goog-api-key").orElse(null));
        verify(metricsRecorder).recordGenerationCall("success", "ok", "gemini-2.0-flash");
    }

    @Test
    void generateResponse_shouldRetryServerErrors() throws Exception {
        HttpResponse<String> unavailable = response(503, "overloaded");
        HttpResponse<String> ok = response(200, OK_BODY);
        when(httpClient.<String>sendAsync(any(HttpRequest.class), any()))
                .thenReturn(CompletableFuture.completedFuture(unavailable))
                .thenReturn(CompletableFuture.completedFuture(ok));

        GenerateContentResponse response = client.generateResponse("describe Lisbon", null);

        assertNotNull(response.firstText());
        verify(httpClient, times(2)).sendAsync(any(HttpRequest.class), any());
    }

    @Test
    void generateResponse_shouldNotRetryClientErrors() {
        HttpResponse<String> badRequest = response(400, "{\"error\": \"bad\"}");
        when(httpClient.<String>sendAsync(any(HttpRequest.class), any()))
                .thenReturn(CompletableFuture.completedFuture(badRequest));

        GenerationException ex = assertThrows(GenerationException.class,
                () -> client.generateResponse("describe Lisbon", GenerationConfig.defaults()));

        assertEquals(ErrorCode.AI_CALL_FAILED.getCode(), ex.getCode().intValue());
        assertTrue(ex.getMessage().contains("http_400"));
        verify(httpClient, times(1)).sendAsync(any(HttpRequest.class), any());
    }

    @Test
    void generateResponse_shouldRejectEmptyCandidates() {
        HttpResponse<String> empty = response(200, "{\"candidates\": []}");
        when(httpClient.<String>sendAsync(any(HttpRequest.class), any()))
                .thenReturn(CompletableFuture.completedFuture(empty));

        GenerationException ex = assertThrows(GenerationException.class,
                () -> client.generateResponse("describe Lisbon", GenerationConfig.defaults()));

        assertTrue(ex.getMessage().contains("bad_response_no_candidates"));
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }
}
