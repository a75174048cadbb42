package com.deliverydispatch.dispatch.service;

/**
 * Weights for the sequential score blend. Each step keeps {@code carry} of the running score
 * and mixes in {@code 1 - carry} of the new signal, so earlier signals fade as later ones apply.
 */
public final class BlendWeights {

    private BlendWeights() {}

    public static final double BASE_SCORE = 100.0;

    // distance: 100 at the door, minus 10 per km
    public static final double DISTANCE_CARRY       = 0.4;
    public static final double DISTANCE_PENALTY_KM  = 10.0;

    // rating: 0–5 stars scaled to 0–100
    public static final double RATING_CARRY         = 0.7;
    public static final double MAX_RATING           = 5.0;
    public static final double UNRATED_RATING       = 3.0;

    // experience: completed jobs, capped
    public static final double EXPERIENCE_CARRY     = 0.9;
    public static final int    EXPERIENCE_CAP       = 100;

    // speed: average completion around 20 minutes is neutral, 2 points per minute either way
    public static final double SPEED_CARRY          = 0.95;
    public static final double SPEED_PIVOT_MINUTES  = 20.0;
    public static final double SPEED_PENALTY_MINUTE = 2.0;
}
