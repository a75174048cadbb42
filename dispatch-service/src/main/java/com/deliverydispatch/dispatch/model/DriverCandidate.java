package com.deliverydispatch.dispatch.model;

import com.deliverydispatch.shared.model.GeoPoint;
import lombok.Builder;
import lombok.Data;

/**
 * Snapshot of a driver evaluated during matching. Built from storage for a single
 * assignment attempt and discarded afterwards.
 */
@Data
@Builder(toBuilder = true)
public class DriverCandidate {

    private long driverId;
    private GeoPoint location;
    private Double rating;
    private int completedJobs;
    private Double averageCompletionMinutes;
    private boolean online;
    private boolean available;
    private boolean verified;
}
