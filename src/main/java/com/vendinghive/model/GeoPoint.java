package com.vendinghive.model;

import lombok.Value;

/**
 * 위도/경도 좌표
 */
@Value
public class GeoPoint {

    private static final double EARTH_RADIUS_METERS = 6_371_000.0;

    double latitude;
    double longitude;

    /**
     * 두 지점 간 거리 (미터, Haversine 공식)
     */
    public double distanceMetersTo(GeoPoint other) {
        double dLat = Math.toRadians(other.latitude - latitude);
        double dLon = Math.toRadians(other.longitude - longitude);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
                Math.cos(Math.toRadians(latitude)) * Math.cos(Math.toRadians(other.latitude)) *
                        Math.sin(dLon / 2) * Math.sin(dLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }
}
