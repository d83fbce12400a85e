package com.loci.common.properties;

import com.loci.common.constant.ChatConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 生成式 AI 配置属性（Gemini generateContent 接口）。
 * Generative AI provider configuration (Gemini generateContent API).
 */
@Data
@ConfigurationProperties(prefix = "loci.ai")
public class AiProperties {

    /**
     * 接口基础地址，例如：https://generativelanguage.googleapis.com/v1beta
     * Base URL of the API, the model path is appended as /models/{model}:generateContent
     */
    private String baseUrl;

    /**
     * API Key，通过 x-goog-api-key 头传递。
     */
    private String apiKey;

    /**
     * 模型名称。
     */
    private String model = ChatConstants.DEFAULT_MODEL;

    /**
     * 采样温度。
     */
    private float temperature = ChatConstants.DEFAULT_TEMPERATURE;

    /**
     * 最大输出 token 数，0 表示不限制（由服务端决定）。
     */
    private int maxOutputTokens = 0;

    /**
     * 连接超时（毫秒）。
     */
    private int connectTimeoutMs = 2000;

    /**
     * 单次请求超时（毫秒）。生成 POI 列表的响应较长，默认放宽到 60 秒。
     */
    private int requestTimeoutMs = 60000;

    /**
     * 最大重试次数（不含首次请求），仅对 429/5xx/超时 生效。
     */
    private int maxRetries = 1;
}
