package com.deliverydispatch.dispatch.entity;

import com.deliverydispatch.shared.enums.VerificationStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Dispatch-relevant slice of a driver's profile. Availability is only ever flipped through
 * the conditional updates in {@code DriverProfileRepository}.
 */
@Entity
@Table(name = "driver_profiles",
        indexes = {
                @Index(name = "idx_driver_dispatchable", columnList = "online, available, verification_status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "userId")
public class DriverProfile {

    @Id
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    @Column(name = "location_updated_at")
    private Instant locationUpdatedAt;

    /** Null until the driver has been rated. */
    private Double rating;

    @Column(name = "completed_jobs", nullable = false)
    private int completedJobs;

    @Column(name = "avg_completion_minutes")
    private Double averageCompletionMinutes;

    @Column(nullable = false)
    private boolean online;

    @Column(nullable = false)
    private boolean available;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", nullable = false)
    private VerificationStatus verificationStatus;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
