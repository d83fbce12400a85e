package com.loci.server.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.loci.pojo.entity.Itinerary;
import com.loci.pojo.entity.ItineraryPoi;
import com.loci.server.mapper.ItineraryMapper;
import com.loci.server.mapper.ItineraryPoiMapper;
import com.loci.server.service.ItineraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ItineraryServiceImpl extends ServiceImpl<ItineraryMapper, Itinerary> implements ItineraryService {

    private final ItineraryPoiMapper itineraryPoiMapper;

    @Override
    public Long upsertItinerary(Long userId, Long cityId, Long sourceInteractionId) {
        // 直接走 DB Upsert，消除并发下“先查再插/更”的竞态
        Long id = baseMapper.upsertItinerary(userId, cityId, sourceInteractionId);
        log.debug("行程 upsert: userId={}, cityId={}, itineraryId={}, sourceInteractionId={}",
                userId, cityId, id, sourceInteractionId);
        return id;
    }

    @Override
    public int saveItineraryPois(Long itineraryId, List<ItineraryPoi> links) {
        if (itineraryId == null || links == null || links.isEmpty()) {
            return 0;
        }
        List<ItineraryPoi> batch = dedupByPoi(itineraryId, links);
        if (batch.isEmpty()) {
            return 0;
        }
        int affected = itineraryPoiMapper.batchUpsert(batch);
        log.debug("行程 POI 关联写入: itineraryId={}, size={}, affected={}", itineraryId, batch.size(), affected);
        return affected;
    }

    /**
     * 同一语句里同一 poi_id 只能出现一次；重复时保留最后一次（顺序与描述以后出现的为准）。
     */
    static List<ItineraryPoi> dedupByPoi(Long itineraryId, List<ItineraryPoi> links) {
        Map<Long, ItineraryPoi> byPoi = new LinkedHashMap<>();
        for (ItineraryPoi link : links) {
            if (link == null || link.getPoiId() == null) {
                continue;
            }
            link.setItineraryId(itineraryId);
            byPoi.remove(link.getPoiId());
            byPoi.put(link.getPoiId(), link);
        }
        return new ArrayList<>(byPoi.values());
    }
}
