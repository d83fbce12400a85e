package com.loci.server.ai.client;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单次生成调用的参数，null 字段使用 AiProperties 默认值。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerationConfig {

    private String model;

    private Float temperature;

    private Integer maxOutputTokens;

    public static GenerationConfig defaults() {
        return new GenerationConfig();
    }

    public static GenerationConfig withTemperature(float temperature) {
        GenerationConfig config = new GenerationConfig();
        config.setTemperature(temperature);
        return config;
    }
}
