package com.loci.server.geo;

import com.loci.pojo.entity.LlmSuggestedPoi;
import com.loci.pojo.entity.PointOfInterest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * 内存中的距离排序，数据库距离查询不可用时兜底。
 * 填充 distance 字段并按距离升序返回新列表；缺少坐标的条目排在最后，distance 为 null。
 */
public final class PoiDistanceRanker {

    private PoiDistanceRanker() {
    }

    public static List<LlmSuggestedPoi> rankSuggested(List<LlmSuggestedPoi> pois, double refLat, double refLon) {
        return rank(pois, LlmSuggestedPoi::getLatitude, LlmSuggestedPoi::getLongitude,
                LlmSuggestedPoi::getDistance, LlmSuggestedPoi::setDistance, refLat, refLon);
    }

    public static List<PointOfInterest> rankCanonical(List<PointOfInterest> pois, double refLat, double refLon) {
        return rank(pois, PointOfInterest::getLatitude, PointOfInterest::getLongitude,
                PointOfInterest::getDistance, PointOfInterest::setDistance, refLat, refLon);
    }

    static <T> List<T> rank(List<T> items,
                            Function<T, Double> latitude,
                            Function<T, Double> longitude,
                            Function<T, Double> distance,
                            BiConsumer<T, Double> distanceSetter,
                            double refLat,
                            double refLon) {
        if (items == null || items.isEmpty()) {
            return new ArrayList<>();
        }
        List<T> ranked = new ArrayList<>(items.size());
        for (T item : items) {
            if (item == null) {
                continue;
            }
            Double lat = latitude.apply(item);
            Double lon = longitude.apply(item);
            if (GeoDistance.isValidCoordinate(lat, lon)) {
                distanceSetter.accept(item, GeoDistance.haversineMeters(refLat, refLon, lat, lon));
            } else {
                distanceSetter.accept(item, null);
            }
            ranked.add(item);
        }
        ranked.sort(Comparator.comparing(distance, Comparator.nullsLast(Comparator.naturalOrder())));
        return ranked;
    }
}
