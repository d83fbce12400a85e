package com.loci.server.config;

import com.loci.common.properties.AiProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 生成式 AI HTTP 客户端配置：
 * - 使用 JDK 自带 HttpClient（连接复用）
 * - 连接超时由 AiProperties 控制，单次请求超时在构造 HttpRequest 时设置
 */
@Configuration
@RequiredArgsConstructor
public class AiHttpClientConfig {

    private final AiProperties aiProperties;

    @Bean
    public HttpClient aiHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(aiProperties.getConnectTimeoutMs()))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }
}
