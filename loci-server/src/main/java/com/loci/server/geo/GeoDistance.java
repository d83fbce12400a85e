package com.loci.server.geo;

/**
 * WGS84 坐标的大圆距离（haversine，地球平均半径），单位米。
 */
public final class GeoDistance {

    /** IUGG 平均地球半径（米） */
    public static final double EARTH_MEAN_RADIUS_M = 6_371_008.8;

    private GeoDistance() {
    }

    public static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_MEAN_RADIUS_M * c;
    }

    public static boolean isValidCoordinate(Double latitude, Double longitude) {
        return latitude != null && longitude != null
                && !latitude.isNaN() && !longitude.isNaN()
                && latitude >= -90 && latitude <= 90
                && longitude >= -180 && longitude <= 180;
    }
}
