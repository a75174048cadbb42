package com.deliverydispatch.dispatch.model;

import java.util.Comparator;

/**
 * An eligible candidate together with its blended score and distance to the request.
 */
public record ScoredCandidate(DriverCandidate candidate, int score, double rawScore, double distanceKm) {

    /**
     * Best first: higher rounded score, then shorter distance, then lower driver id.
     */
    public static final Comparator<ScoredCandidate> RANKING = Comparator
            .comparingInt(ScoredCandidate::score).reversed()
            .thenComparingDouble(ScoredCandidate::distanceKm)
            .thenComparingLong(ScoredCandidate::driverId);

    public long driverId() {
        return candidate.getDriverId();
    }
}
