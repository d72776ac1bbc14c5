package com.whatshouldido.util;

/**
 * 위경도 거리 계산 (Haversine 공식)
 */
public final class GeoUtils {

    private static final double EARTH_RADIUS_METERS = 6_371_000.0;
    private static final double WALKING_SPEED_METERS_PER_MINUTE = 5000.0 / 60.0; // 도보 속도 5km/h

    private GeoUtils() {
    }

    public static double distanceMeters(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
                Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) *
                Math.sin(dLon / 2) * Math.sin(dLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    public static int walkingMinutes(double distanceMeters) {
        return (int) Math.ceil(distanceMeters / WALKING_SPEED_METERS_PER_MINUTE);
    }
}
