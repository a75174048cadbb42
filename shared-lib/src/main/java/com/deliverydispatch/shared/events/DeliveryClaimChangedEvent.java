package com.deliverydispatch.shared.events;

import com.deliverydispatch.shared.enums.ClaimStatus;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Published when a driver accepts, declines or is released from a claimed delivery.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryClaimChangedEvent {

    public static final String TOPIC = "delivery.claim.changed";

    private Long requestId;
    private Long driverId;
    private ClaimStatus status;
    private String reason;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant changedAt;
}
