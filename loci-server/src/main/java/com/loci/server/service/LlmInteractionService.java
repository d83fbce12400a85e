package com.loci.server.service;

import com.loci.pojo.entity.LlmInteraction;

public interface LlmInteractionService {

    /**
     * 单事务写入：交互记录 → 城市解析 → 行程 upsert → POI 解析/去重 → 行程 POI 关联。
     *
     * @return 交互记录 ID
     */
    Long saveInteraction(LlmInteraction interaction);

    boolean exists(Long interactionId);
}
