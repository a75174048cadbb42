package com.deliverydispatch.dispatch.storage;

import com.deliverydispatch.dispatch.model.DeliveryRequestView;
import com.deliverydispatch.dispatch.model.DriverCandidate;
import com.deliverydispatch.shared.model.GeoPoint;

import java.util.List;
import java.util.Optional;

/**
 * Persistent driver and delivery state used by dispatch.
 * Implementations signal retryable failures with
 * {@link com.deliverydispatch.dispatch.exception.TransientStorageException}.
 */
public interface DispatchStorage {

    /** Drivers that are online, available and verified. Location and radius are not filtered here. */
    List<DriverCandidate> fetchEligibleDrivers();

    /**
     * Atomically reserves the driver and attaches it to the request, or changes nothing.
     */
    ClaimOutcome conditionalClaim(long requestId, long driverId);

    void setDriverAvailability(long driverId, boolean available);

    /** CLAIMED → ACCEPTED, only for the driver holding the claim. */
    boolean confirmClaim(long requestId, long driverId);

    /** CLAIMED → UNASSIGNED, only for the driver holding the claim. */
    boolean releaseClaim(long requestId, long driverId);

    /** CLAIMED or ACCEPTED → UNASSIGNED, only for the driver attached to the request. */
    boolean releaseAssignment(long requestId, long driverId);

    Optional<DeliveryRequestView> findRequest(long requestId);

    /** Newest unassigned requests first, at most {@code limit}. */
    List<DeliveryRequestView> findRecentUnassigned(int limit);

    /** The driver's current profile whether or not they are eligible. */
    Optional<DriverCandidate> findDriver(long driverId);

    void updateDriverLocation(long driverId, GeoPoint location);
}
