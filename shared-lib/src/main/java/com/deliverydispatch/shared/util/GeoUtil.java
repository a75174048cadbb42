package com.deliverydispatch.shared.util;

import com.deliverydispatch.shared.model.GeoPoint;
import com.uber.h3core.H3Core;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/**
 * Distance, travel-time and H3 cell helpers used by dispatch.
 * Resolution 9 ≈ 0.10 km², fine enough to tag driver positions for geo-fencing.
 */
public final class GeoUtil {

    public static final int DISPATCH_RESOLUTION = 9;
    public static final double EARTH_RADIUS_KM = 6371.0;

    /** Speeds below this are treated as this, so a stationary estimate never divides by zero. */
    public static final double MIN_SPEED_KMH = 5.0;

    /** Average urban courier speed used for requester-facing arrival estimates. */
    public static final double URBAN_SPEED_KMH = 25.0;
    public static final double MAX_ARRIVAL_BUFFER_MINUTES = 15.0;

    private static final H3Core h3;

    static {
        try {
            h3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialise H3Core", e);
        }
    }

    private GeoUtil() {}

    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static double distanceKm(GeoPoint from, GeoPoint to) {
        return distanceKm(from.latitude(), from.longitude(), to.latitude(), to.longitude());
    }

    /**
     * Linear travel time in minutes at the given speed, floored at {@link #MIN_SPEED_KMH}.
     */
    public static double etaMinutes(double distanceKm, double assumedSpeedKmh) {
        double speed = Math.max(assumedSpeedKmh, MIN_SPEED_KMH);
        return Math.max(distanceKm, 0.0) / speed * 60.0;
    }

    /**
     * Arrival estimate shown to requesters: urban travel time plus a pickup buffer of
     * two minutes per km, capped at fifteen minutes.
     */
    public static Instant estimatedArrival(double distanceKm, Instant now) {
        double minutes = etaMinutes(distanceKm, URBAN_SPEED_KMH)
                + Math.min(Math.max(distanceKm, 0.0) * 2.0, MAX_ARRIVAL_BUFFER_MINUTES);
        return now.plus(Duration.ofSeconds(Math.round(minutes * 60.0)));
    }

    public static String dispatchCell(double lat, double lng) {
        return h3.latLngToCellAddress(lat, lng, DISPATCH_RESOLUTION);
    }
}
