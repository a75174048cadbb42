package com.deliverydispatch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryAssignedEvent {

    public static final String TOPIC = "delivery.assigned";

    private Long requestId;
    private Long requesterId;
    private Long driverId;
    private int score;
    private double distanceKm;
    private int attempt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant estimatedArrival;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant assignedAt;
}
