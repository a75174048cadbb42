package com.deliverydispatch.shared.model;

/**
 * A validated WGS84 coordinate. Construction fails for out-of-range or non-finite values,
 * so any GeoPoint in hand is safe to feed into distance math.
 */
public record GeoPoint(double latitude, double longitude) {

    public GeoPoint {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("Latitude must be within [-90, 90], got " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("Longitude must be within [-180, 180], got " + longitude);
        }
    }

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    /**
     * Nullable variant for persisted coordinates, where either column may be missing.
     */
    public static GeoPoint ofNullable(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) {
            return null;
        }
        return new GeoPoint(latitude, longitude);
    }
}
