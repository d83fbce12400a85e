package com.loci.server.service.impl;

import com.loci.common.constant.ChatConstants;
import com.loci.pojo.ai.PoiDetailedInfo;
import com.loci.pojo.entity.ItineraryPoi;
import com.loci.pojo.entity.LlmInteraction;
import com.loci.server.ai.normalizer.PoiResponseParser;
import com.loci.server.mapper.LlmInteractionMapper;
import com.loci.server.persistence.TransactionRunner;
import com.loci.server.service.CityService;
import com.loci.server.service.ItineraryService;
import com.loci.server.service.LlmInteractionService;
import com.loci.server.service.PoiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * LLM 交互落库。
 *
 * saveInteraction 在一个事务里完成：
 * 1. 写 llm_interactions 拿到 ID；
 * 2. 按城市名精确匹配 cities，找不到只记日志，交互照常保存；
 * 3. upsert (user, city) 行程，来源交互指向本次；
 * 4. 住宿/餐饮/活动领域的回复不解析 POI；
 * 5. 解析响应中的 POI，逐个取或建规范化 POI；
 * 6. 批量 upsert 行程 POI 关联；
 * 7. 提交。任一步失败整体回滚。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmInteractionServiceImpl implements LlmInteractionService {

    private static final List<String> DOMAIN_SPECIFIC_MARKERS = List.of(
            ChatConstants.MARKER_DINING,
            ChatConstants.MARKER_ACCOMMODATION,
            ChatConstants.MARKER_ACTIVITIES);

    private final LlmInteractionMapper llmInteractionMapper;
    private final CityService cityService;
    private final ItineraryService itineraryService;
    private final PoiService poiService;
    private final PoiResponseParser poiResponseParser;
    private final TransactionRunner transactionRunner;

    @Override
    public Long saveInteraction(LlmInteraction interaction) {
        if (interaction == null) {
            throw new IllegalArgumentException("interaction must not be null");
        }
        return transactionRunner.inTransaction("save_interaction", tx -> {
            tx.step("insert_interaction");
            if (interaction.getCreatedAt() == null) {
                interaction.setCreatedAt(LocalDateTime.now());
            }
            llmInteractionMapper.insert(interaction);
            Long interactionId = interaction.getId();
            if (interactionId == null) {
                throw new IllegalStateException("llm interaction id was not generated");
            }

            String cityName = interaction.getCityName();
            if (!StringUtils.hasText(cityName) || interaction.getUserId() == null) {
                log.debug("交互缺少城市或用户，跳过行程: interactionId={}", interactionId);
                return interactionId;
            }

            tx.step("resolve_city");
            Long cityId = cityService.findIdByName(cityName);
            if (cityId == null) {
                log.warn("城市不存在，跳过行程与 POI: cityName={}, interactionId={}", cityName, interactionId);
                return interactionId;
            }

            tx.step("upsert_itinerary");
            Long itineraryId = itineraryService.upsertItinerary(interaction.getUserId(), cityId, interactionId);

            if (shouldSkipPoiExtraction(interaction)) {
                log.info("领域专用回复，不解析 POI: interactionId={}, domain={}", interactionId, interaction.getDomain());
                return interactionId;
            }

            tx.step("parse_pois");
            List<PoiDetailedInfo> pois = poiResponseParser.parse(interaction.getResponse());
            if (pois.isEmpty()) {
                return interactionId;
            }

            tx.step("resolve_pois");
            List<ItineraryPoi> links = new ArrayList<>(pois.size());
            for (int i = 0; i < pois.size(); i++) {
                PoiDetailedInfo poi = pois.get(i);
                if (!StringUtils.hasText(poi.getName())) {
                    continue;
                }
                Long poiId = poiService.getOrCreatePoi(poi.getName(), cityId, poi.getLongitude(), poi.getLatitude(),
                        poi.getCategory(), poi.resolveDescription());
                links.add(new ItineraryPoi(itineraryId, poiId, i, poi.resolveDescription()));
            }

            tx.step("link_itinerary_pois");
            int linked = itineraryService.saveItineraryPois(itineraryId, links);
            log.info("交互落库完成: interactionId={}, itineraryId={}, pois={}, linked={}",
                    interactionId, itineraryId, pois.size(), linked);
            return interactionId;
        });
    }

    @Override
    public boolean exists(Long interactionId) {
        return interactionId != null && llmInteractionMapper.existsById(interactionId);
    }

    /**
     * 显式 domain 为领域专用，或 prompt 含领域标记，二者满足其一即跳过。
     */
    static boolean shouldSkipPoiExtraction(LlmInteraction interaction) {
        if (interaction.getDomain() != null && interaction.getDomain().isDomainSpecific()) {
            return true;
        }
        String prompt = interaction.getPrompt();
        if (prompt == null) {
            return false;
        }
        for (String marker : DOMAIN_SPECIFIC_MARKERS) {
            if (prompt.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
