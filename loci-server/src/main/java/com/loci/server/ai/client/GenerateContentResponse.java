package com.loci.server.ai.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * generateContent 响应：candidates[].content.parts[].text + usageMetadata。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerateContentResponse {

    private List<Candidate> candidates = new ArrayList<>();

    private UsageMetadata usageMetadata;

    /** 实际使用的模型，由客户端回填 */
    private String modelVersion;

    /**
     * 取第一个「content 非空且 parts 非空」的候选的第一个 part 文本；没有则返回 null。
     */
    public String firstText() {
        if (candidates == null) {
            return null;
        }
        for (Candidate candidate : candidates) {
            if (candidate == null || candidate.getContent() == null) {
                continue;
            }
            List<Part> parts = candidate.getContent().getParts();
            if (parts != null && !parts.isEmpty() && parts.get(0) != null) {
                return parts.get(0).getText();
            }
        }
        return null;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Candidate {
        private Content content;
        private String finishReason;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Content {
        private String role;
        private List<Part> parts = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Part {
        private String text;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UsageMetadata {
        private Integer promptTokenCount;
        private Integer candidatesTokenCount;
        private Integer totalTokenCount;
    }

    public static GenerateContentResponse ofText(String text) {
        Part part = new Part();
        part.setText(text);
        Content content = new Content();
        content.setRole("model");
        content.getParts().add(part);
        Candidate candidate = new Candidate();
        candidate.setContent(content);
        GenerateContentResponse response = new GenerateContentResponse();
        response.getCandidates().add(candidate);
        return response;
    }
}
