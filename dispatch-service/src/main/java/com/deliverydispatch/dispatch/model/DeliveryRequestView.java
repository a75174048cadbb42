package com.deliverydispatch.dispatch.model;

import com.deliverydispatch.shared.enums.ClaimStatus;
import com.deliverydispatch.shared.model.GeoPoint;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.Instant;

/**
 * Read model of a delivery request's assignment state.
 */
public record DeliveryRequestView(
        long requestId,
        long requesterId,
        GeoPoint pickup,
        GeoPoint dropoff,
        ClaimStatus status,
        Long driverId,
        @JsonFormat(shape = JsonFormat.Shape.STRING) Instant createdAt,
        @JsonFormat(shape = JsonFormat.Shape.STRING) Instant claimedAt) {
}
