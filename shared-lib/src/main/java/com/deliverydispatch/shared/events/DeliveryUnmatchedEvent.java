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
public class DeliveryUnmatchedEvent {

    public static final String TOPIC = "delivery.unmatched";

    private Long requestId;
    private String reason;
    private boolean degraded;
    private int candidatesConsidered;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant occurredAt;
}
