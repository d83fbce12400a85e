package com.loci.server.service.impl;

import com.loci.common.exception.BaseException;
import com.loci.pojo.ai.GeneralCityData;
import com.loci.pojo.ai.PoiDetailedInfo;
import com.loci.pojo.dto.CityBundleRequestDTO;
import com.loci.pojo.entity.City;
import com.loci.pojo.entity.ItineraryPoi;
import com.loci.pojo.entity.LlmSuggestedPoi;
import com.loci.pojo.vo.CityBundleVO;
import com.loci.server.geo.GeoDistance;
import com.loci.server.geo.PoiDistanceRanker;
import com.loci.server.persistence.TransactionRunner;
import com.loci.server.service.CityBundlePersistenceService;
import com.loci.server.service.CityService;
import com.loci.server.service.ItineraryService;
import com.loci.server.service.PoiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 合并结果落库，失败只写进 bundle.errors["persistence"]，已生成的内容照常返回。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CityBundlePersistenceServiceImpl implements CityBundlePersistenceService {

    public static final String ERROR_KEY = "persistence";

    private final CityService cityService;
    private final PoiService poiService;
    private final ItineraryService itineraryService;
    private final TransactionRunner transactionRunner;

    @Override
    public void persist(CityBundleRequestDTO request, CityBundleVO bundle) {
        try {
            Long cityId = resolveCity(bundle);
            if (cityId == null) {
                log.warn("无法确定城市，跳过 POI 落库: cityName={}", bundle.getCityName());
                bundle.getErrors().put(ERROR_KEY, "city could not be resolved: " + bundle.getCityName());
                return;
            }
            bundle.setCityId(cityId);
            saveGeneralPois(cityId, bundle.getGeneralPois());
            savePersonalized(request, bundle, cityId);
        } catch (BaseException | DataAccessException e) {
            log.error("城市结果落库失败: cityName={}, error={}", bundle.getCityName(), e.getMessage(), e);
            bundle.getErrors().put(ERROR_KEY, e.getMessage());
        }
    }

    private Long resolveCity(CityBundleVO bundle) {
        GeneralCityData cityData = bundle.getCityData();
        if (cityData != null) {
            City city = cityService.findOrCreate(cityData);
            if (city != null && city.getId() != null) {
                return city.getId();
            }
        }
        return cityService.findIdByName(bundle.getCityName());
    }

    private void saveGeneralPois(Long cityId, List<PoiDetailedInfo> pois) {
        if (pois == null || pois.isEmpty()) {
            return;
        }
        int saved = transactionRunner.inTransaction("save_general_pois", tx -> {
            tx.step("get_or_create_poi");
            int count = 0;
            for (PoiDetailedInfo poi : pois) {
                if (poi == null || !StringUtils.hasText(poi.getName())) {
                    continue;
                }
                poiService.getOrCreatePoi(poi.getName().trim(), cityId, poi.getLongitude(), poi.getLatitude(),
                        poi.getCategory(), poi.resolveDescription());
                count++;
            }
            return count;
        });
        log.info("通用 POI 落库: cityId={}, saved={}", cityId, saved);
    }

    private void savePersonalized(CityBundleRequestDTO request, CityBundleVO bundle, Long cityId) {
        List<PoiDetailedInfo> pois = bundle.getPersonalizedPois();
        Long interactionId = bundle.getLlmInteractionId();
        if (pois == null || pois.isEmpty() || interactionId == null) {
            return;
        }
        List<LlmSuggestedPoi> suggested = poiService.saveLlmSuggestedPoisBatch(request.getUserId(),
                request.getProfileId(), cityId, interactionId, pois);

        if (request.getUserId() != null) {
            transactionRunner.inTransaction("link_personalized_pois", tx -> {
                tx.step("upsert_itinerary");
                Long itineraryId = itineraryService.upsertItinerary(request.getUserId(), cityId, interactionId);
                tx.step("get_or_create_poi");
                List<ItineraryPoi> links = new ArrayList<>(pois.size());
                for (int i = 0; i < pois.size(); i++) {
                    PoiDetailedInfo poi = pois.get(i);
                    if (poi == null || !StringUtils.hasText(poi.getName())) {
                        continue;
                    }
                    Long poiId = poiService.getOrCreatePoi(poi.getName().trim(), cityId, poi.getLongitude(),
                            poi.getLatitude(), poi.getCategory(), poi.resolveDescription());
                    links.add(new ItineraryPoi(itineraryId, poiId, i, poi.resolveDescription()));
                }
                tx.step("link_itinerary_pois");
                return itineraryService.saveItineraryPois(itineraryId, links);
            });
        }

        double[] ref = referencePoint(request, bundle);
        if (ref == null) {
            bundle.setRankedSuggestedPois(suggested);
            return;
        }
        bundle.setRankedSuggestedPois(rankSuggested(interactionId, cityId, suggested, ref[0], ref[1]));
    }

    private List<LlmSuggestedPoi> rankSuggested(Long interactionId, Long cityId, List<LlmSuggestedPoi> saved,
                                                double lat, double lon) {
        try {
            return poiService.listSuggestedPoisByDistance(interactionId, cityId, lat, lon);
        } catch (DataAccessException e) {
            log.warn("距离查询失败，改用内存排序: interactionId={}, error={}", interactionId, e.getMessage());
            return PoiDistanceRanker.rankSuggested(saved, lat, lon);
        }
    }

    /**
     * 用户位置优先，其次城市中心；都没有时不排序。
     */
    static double[] referencePoint(CityBundleRequestDTO request, CityBundleVO bundle) {
        if (GeoDistance.isValidCoordinate(request.getUserLatitude(), request.getUserLongitude())) {
            return new double[]{request.getUserLatitude(), request.getUserLongitude()};
        }
        GeneralCityData cityData = bundle.getCityData();
        if (cityData != null && GeoDistance.isValidCoordinate(cityData.getCenterLatitude(), cityData.getCenterLongitude())) {
            return new double[]{cityData.getCenterLatitude(), cityData.getCenterLongitude()};
        }
        return null;
    }
}
