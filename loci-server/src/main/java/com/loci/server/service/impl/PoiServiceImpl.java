package com.loci.server.service.impl;

import com.loci.common.exception.BaseException;
import com.loci.common.exception.PersistenceException;
import com.loci.common.result.ErrorCode;
import com.loci.pojo.ai.PoiDetailedInfo;
import com.loci.pojo.entity.LlmSuggestedPoi;
import com.loci.pojo.entity.PointOfInterest;
import com.loci.server.geo.GeoDistance;
import com.loci.server.mapper.LlmInteractionMapper;
import com.loci.server.mapper.LlmSuggestedPoiMapper;
import com.loci.server.mapper.PointOfInterestMapper;
import com.loci.server.persistence.TransactionRunner;
import com.loci.server.service.PoiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
@RequiredArgsConstructor
@Slf4j
public class PoiServiceImpl implements PoiService {

    private final PointOfInterestMapper pointOfInterestMapper;
    private final LlmSuggestedPoiMapper llmSuggestedPoiMapper;
    private final LlmInteractionMapper llmInteractionMapper;
    private final TransactionRunner transactionRunner;

    /**
     * 先查后插；未命中时走 INSERT ... ON CONFLICT (name, city_id) RETURNING id，
     * 并发插入同名 POI 时拿到的也是已存在行的 ID。
     * 不自开事务：在调用方事务内执行时与之一起提交/回滚。
     */
    @Override
    public Long getOrCreatePoi(String name, Long cityId, Double longitude, Double latitude,
                               String category, String description) {
        if (!StringUtils.hasText(name) || cityId == null) {
            throw new IllegalArgumentException("poi name and cityId are required");
        }
        Long existing = pointOfInterestMapper.findIdByNameAndCity(name, cityId);
        if (existing != null) {
            return existing;
        }
        Long id = pointOfInterestMapper.insertOrGetId(name, cityId, longitude, latitude, category, description);
        log.debug("新建 POI: id={}, name={}, cityId={}", id, name, cityId);
        return id;
    }

    @Override
    public List<LlmSuggestedPoi> saveLlmSuggestedPoisBatch(Long userId, Long searchProfileId, Long cityId,
                                                          Long interactionId, List<PoiDetailedInfo> pois) {
        if (interactionId == null) {
            throw new PersistenceException(ErrorCode.INTERACTION_NOT_FOUND, "check_interaction",
                    "llm interaction id is required");
        }
        return transactionRunner.inTransaction("save_suggested_pois", tx -> {
            tx.step("check_interaction");
            if (!llmInteractionMapper.existsById(interactionId)) {
                throw new PersistenceException(ErrorCode.INTERACTION_NOT_FOUND, "check_interaction",
                        "llm interaction " + interactionId + " does not exist");
            }
            List<LlmSuggestedPoi> rows = toSuggestedRows(userId, searchProfileId, cityId, interactionId, pois);
            if (rows.isEmpty()) {
                return rows;
            }
            tx.step("batch_insert");
            int affected = llmSuggestedPoiMapper.batchInsert(rows);
            log.info("建议 POI 批量写入: interactionId={}, cityId={}, size={}, affected={}",
                    interactionId, cityId, rows.size(), affected);
            return rows;
        });
    }

    @Override
    public Long saveSinglePoi(Long userId, Long cityId, Long interactionId, PoiDetailedInfo poi) {
        if (poi == null || !StringUtils.hasText(poi.getName())) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "poi name is required");
        }
        if (!GeoDistance.isValidCoordinate(poi.getLatitude(), poi.getLongitude())) {
            throw new BaseException(ErrorCode.INVALID_COORDINATES,
                    "invalid coordinates: latitude=" + poi.getLatitude() + ", longitude=" + poi.getLongitude());
        }
        LlmSuggestedPoi row = toSuggestedRow(userId, null, cityId, interactionId, poi);
        Long id = llmSuggestedPoiMapper.upsertSingle(row);
        log.debug("保存单个建议 POI: id={}, name={}", id, poi.getName());
        return id;
    }

    @Override
    public List<LlmSuggestedPoi> listSuggestedPoisByDistance(Long interactionId, Long cityId,
                                                            double latitude, double longitude) {
        if (interactionId == null) {
            return Collections.emptyList();
        }
        requireValidReference(latitude, longitude);
        return llmSuggestedPoiMapper.listByInteractionSortedByDistance(interactionId, cityId, longitude, latitude);
    }

    @Override
    public List<PointOfInterest> listCityPoisByDistance(Long cityId, double latitude, double longitude) {
        if (cityId == null) {
            return Collections.emptyList();
        }
        requireValidReference(latitude, longitude);
        return pointOfInterestMapper.listByCitySortedByDistance(cityId, longitude, latitude);
    }

    private void requireValidReference(double latitude, double longitude) {
        if (!GeoDistance.isValidCoordinate(latitude, longitude)) {
            throw new BaseException(ErrorCode.INVALID_COORDINATES,
                    "invalid reference point: latitude=" + latitude + ", longitude=" + longitude);
        }
    }

    /**
     * 去掉无名称的条目；同名同坐标只保留最后一条，避免同一语句命中同一唯一键两次。
     */
    static List<LlmSuggestedPoi> toSuggestedRows(Long userId, Long searchProfileId, Long cityId,
                                                 Long interactionId, List<PoiDetailedInfo> pois) {
        if (pois == null || pois.isEmpty()) {
            return new ArrayList<>();
        }
        Map<String, LlmSuggestedPoi> byKey = new LinkedHashMap<>();
        for (PoiDetailedInfo poi : pois) {
            if (poi == null || !StringUtils.hasText(poi.getName())) {
                log.warn("跳过无名称的建议 POI: interactionId={}", interactionId);
                continue;
            }
            LlmSuggestedPoi row = toSuggestedRow(userId, searchProfileId, cityId, interactionId, poi);
            String key = row.getName() + "|" + Objects.toString(row.getLatitude()) + "|" + Objects.toString(row.getLongitude());
            byKey.remove(key);
            byKey.put(key, row);
        }
        return new ArrayList<>(byKey.values());
    }

    private static LlmSuggestedPoi toSuggestedRow(Long userId, Long searchProfileId, Long cityId,
                                                  Long interactionId, PoiDetailedInfo poi) {
        LlmSuggestedPoi row = new LlmSuggestedPoi();
        row.setUserId(userId);
        row.setSearchProfileId(searchProfileId);
        row.setLlmInteractionId(interactionId);
        row.setCityId(cityId);
        row.setName(poi.getName().trim());
        row.setDescriptionPoi(poi.resolveDescription());
        row.setCategory(poi.getCategory());
        row.setAddress(poi.getAddress());
        row.setWebsite(poi.getWebsite());
        row.setLatitude(poi.getLatitude());
        row.setLongitude(poi.getLongitude());
        return row;
    }
}
