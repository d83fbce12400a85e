package com.loci.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.loci.pojo.enums.ChatDomain;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 一次模型调用的记录，写入后不再修改。
 */
@Data
@TableName("llm_interactions")
public class LlmInteraction {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long userId;

    /** 所属会话，可为空 */
    private String sessionId;

    private String cityName;

    private String prompt;

    private String response;

    private String modelName;

    private Integer promptTokens;

    private Integer completionTokens;

    private Integer totalTokens;

    private Long latencyMs;

    /**
     * 生成时的对话领域。住宿/餐饮/活动领域的回复不会解析成行程 POI。
     */
    private ChatDomain domain;

    private LocalDateTime createdAt;
}
