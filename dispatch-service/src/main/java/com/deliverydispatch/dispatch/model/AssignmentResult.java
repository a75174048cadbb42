package com.deliverydispatch.dispatch.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AssignmentResult {

    long requestId;
    AssignmentOutcome outcome;
    Long driverId;
    Long requesterId;
    Integer score;
    Double distanceKm;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant estimatedArrival;

    UnmatchedReason reason;
    boolean degraded;
    int attempts;

    @JsonIgnore
    public boolean isAssigned() {
        return outcome == AssignmentOutcome.ASSIGNED;
    }

    public static AssignmentResult assigned(long requestId, Long requesterId, ScoredCandidate winner,
                                            Instant estimatedArrival, int attempts) {
        return AssignmentResult.builder()
                .requestId(requestId)
                .outcome(AssignmentOutcome.ASSIGNED)
                .driverId(winner.driverId())
                .requesterId(requesterId)
                .score(winner.score())
                .distanceKm(winner.distanceKm())
                .estimatedArrival(estimatedArrival)
                .attempts(attempts)
                .build();
    }

    public static AssignmentResult unmatched(long requestId, UnmatchedReason reason, int attempts) {
        return AssignmentResult.builder()
                .requestId(requestId)
                .outcome(AssignmentOutcome.NO_ELIGIBLE_DRIVER)
                .reason(reason)
                .degraded(reason == UnmatchedReason.STORAGE_UNAVAILABLE)
                .attempts(attempts)
                .build();
    }
}
