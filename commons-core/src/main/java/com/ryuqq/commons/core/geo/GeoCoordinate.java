package com.ryuqq.commons.core.geo;

import com.ryuqq.commons.core.measurement.Distance;

/**
 * 위경도 좌표 (도 단위).
 *
 * <p>위도는 -90~90, 경도는 -180~180 범위입니다. 위치를 모르는 경우 {@link #UNKNOWN}
 * (NaN 쌍)을 사용합니다.</p>
 *
 * @param latitude 위도
 * @param longitude 경도
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GeoCoordinate(
    double latitude,
    double longitude
) {

    public static final GeoCoordinate ZERO = new GeoCoordinate(0, 0);
    public static final GeoCoordinate UNKNOWN = new GeoCoordinate(Double.NaN, Double.NaN);

    private static final double EARTH_RADIUS_METERS = 6_376_500;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 위도 또는 경도가 범위를 벗어난 경우
     */
    public GeoCoordinate {
        if (latitude > 90.0 || latitude < -90.0) {
            throw new IllegalArgumentException("latitude must be between -90 and 90 (current: " + latitude + ")");
        }
        if (longitude > 180.0 || longitude < -180.0) {
            throw new IllegalArgumentException("longitude must be between -180 and 180 (current: " + longitude + ")");
        }
    }

    public static GeoCoordinate of(double latitude, double longitude) {
        return new GeoCoordinate(latitude, longitude);
    }

    public boolean isUnknown() {
        return equals(UNKNOWN);
    }

    /**
     * 두 좌표 사이의 대권 거리 (Haversine).
     *
     * @param other 대상 좌표
     * @return 거리
     * @throws IllegalArgumentException other가 null이거나 어느 한쪽 좌표에 NaN이 있는 경우
     */
    public Distance distanceTo(GeoCoordinate other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        if (Double.isNaN(latitude) || Double.isNaN(longitude)
            || Double.isNaN(other.latitude) || Double.isNaN(other.longitude)) {
            throw new IllegalArgumentException("latitude or longitude is not a number");
        }

        double lat1 = Math.toRadians(latitude);
        double lat2 = Math.toRadians(other.latitude);
        double deltaLat = lat2 - lat1;
        double deltaLon = Math.toRadians(other.longitude) - Math.toRadians(longitude);

        double a = Math.pow(Math.sin(deltaLat / 2.0), 2.0)
            + Math.cos(lat1) * Math.cos(lat2) * Math.pow(Math.sin(deltaLon / 2.0), 2.0);
        double c = 2.0 * Math.atan2(Math.sqrt(a), Math.sqrt(1.0 - a));

        return Distance.ofMeters(EARTH_RADIUS_METERS * c);
    }
}
