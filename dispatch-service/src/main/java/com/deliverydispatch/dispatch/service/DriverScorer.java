package com.deliverydispatch.dispatch.service;

import com.deliverydispatch.dispatch.config.DispatchProperties;
import com.deliverydispatch.dispatch.model.DriverCandidate;
import com.deliverydispatch.dispatch.model.ScoredCandidate;
import com.deliverydispatch.shared.model.GeoPoint;
import com.deliverydispatch.shared.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

import static com.deliverydispatch.dispatch.service.BlendWeights.*;

/**
 * Ranks drivers for a delivery. Ineligible drivers are filtered out, never scored at zero.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriverScorer {

    private final DispatchProperties properties;

    /**
     * Scores one candidate against the request location, or returns empty if the candidate is
     * offline, unavailable, unverified, has no known location or is beyond the search radius.
     */
    public Optional<ScoredCandidate> score(DriverCandidate candidate, GeoPoint requestLocation) {
        if (!candidate.isOnline() || !candidate.isAvailable() || !candidate.isVerified()) {
            return Optional.empty();
        }
        if (candidate.getLocation() == null) {
            return Optional.empty();
        }

        double distanceKm = GeoUtil.distanceKm(candidate.getLocation(), requestLocation);
        if (distanceKm > properties.getAssignment().getMaxRadiusKm()) {
            log.debug("Driver {} is {} km away, outside radius", candidate.getDriverId(), distanceKm);
            return Optional.empty();
        }

        double raw = blend(distanceKm, candidate.getRating(), candidate.getCompletedJobs(),
                candidate.getAverageCompletionMinutes());
        int score = (int) Math.round(raw);
        log.debug("Driver {} scored {} ({} km)", candidate.getDriverId(), score, distanceKm);
        return Optional.of(new ScoredCandidate(candidate, score, raw, distanceKm));
    }

    /**
     * Scores every candidate and returns the eligible ones, best first.
     */
    public List<ScoredCandidate> rank(List<DriverCandidate> candidates, GeoPoint requestLocation) {
        return candidates.stream()
                .map(c -> score(c, requestLocation))
                .flatMap(Optional::stream)
                .sorted(ScoredCandidate.RANKING)
                .toList();
    }

    /**
     * Sequential blend of distance, rating, experience and speed. A missing or zero rating counts
     * as {@link BlendWeights#UNRATED_RATING}; a missing or zero average completion time means no
     * delivery history, so the speed step is skipped.
     */
    double blend(double distanceKm, Double rating, int completedJobs, Double averageCompletionMinutes) {
        double s = BASE_SCORE;

        double distanceScore = Math.max(0.0, 100.0 - distanceKm * DISTANCE_PENALTY_KM);
        s = s * DISTANCE_CARRY + distanceScore * (1 - DISTANCE_CARRY);

        double effectiveRating = rating == null || rating == 0.0 ? UNRATED_RATING : rating;
        double ratingScore = (effectiveRating / MAX_RATING) * 100.0;
        s = s * RATING_CARRY + ratingScore * (1 - RATING_CARRY);

        double experienceScore = Math.min(completedJobs, EXPERIENCE_CAP);
        s = s * EXPERIENCE_CARRY + experienceScore * (1 - EXPERIENCE_CARRY);

        if (averageCompletionMinutes != null && averageCompletionMinutes > 0) {
            double speedScore = Math.max(0.0,
                    100.0 - (averageCompletionMinutes - SPEED_PIVOT_MINUTES) * SPEED_PENALTY_MINUTE);
            s = s * SPEED_CARRY + speedScore * (1 - SPEED_CARRY);
        }
        return s;
    }
}
