package com.deliverydispatch.dispatch.storage;

import com.deliverydispatch.dispatch.entity.DeliveryRequest;
import com.deliverydispatch.dispatch.entity.DriverProfile;
import com.deliverydispatch.dispatch.exception.TransientStorageException;
import com.deliverydispatch.dispatch.model.DeliveryRequestView;
import com.deliverydispatch.dispatch.model.DriverCandidate;
import com.deliverydispatch.dispatch.repository.DeliveryRequestRepository;
import com.deliverydispatch.dispatch.repository.DriverProfileRepository;
import com.deliverydispatch.shared.enums.ClaimStatus;
import com.deliverydispatch.shared.enums.VerificationStatus;
import com.deliverydispatch.shared.model.GeoPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relational adapter over {@code driver_profiles} and {@code delivery_requests}.
 *
 * The claim runs two compare-and-set updates in one transaction: reserve the driver, then
 * attach it to the request. When the request was already taken the reservation is undone
 * before commit, so a losing claim leaves both rows as it found them.
 */
@Slf4j
@Component
public class JpaDispatchStorage implements DispatchStorage {

    private final DriverProfileRepository driverProfileRepository;
    private final DeliveryRequestRepository deliveryRequestRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JpaDispatchStorage(DriverProfileRepository driverProfileRepository,
                              DeliveryRequestRepository deliveryRequestRepository,
                              PlatformTransactionManager transactionManager,
                              Clock clock) {
        this.driverProfileRepository = driverProfileRepository;
        this.deliveryRequestRepository = deliveryRequestRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    public List<DriverCandidate> fetchEligibleDrivers() {
        return translate("fetchEligibleDrivers", () -> driverProfileRepository
                .findByOnlineTrueAndAvailableTrueAndVerificationStatus(VerificationStatus.VERIFIED)
                .stream()
                .map(this::toCandidate)
                .toList());
    }

    @Override
    public ClaimOutcome conditionalClaim(long requestId, long driverId) {
        return translate("conditionalClaim", () -> transactionTemplate.execute(status -> {
            if (!deliveryRequestRepository.existsById(requestId)) {
                return ClaimOutcome.REQUEST_NOT_FOUND;
            }
            if (driverProfileRepository.reserveIfAvailable(driverId) == 0) {
                return ClaimOutcome.DRIVER_UNAVAILABLE;
            }
            int claimed = deliveryRequestRepository.claimIfUnassigned(
                    requestId, driverId, ClaimStatus.CLAIMED, ClaimStatus.UNASSIGNED, clock.instant());
            if (claimed == 0) {
                driverProfileRepository.updateAvailability(driverId, true);
                return ClaimOutcome.REQUEST_ALREADY_CLAIMED;
            }
            return ClaimOutcome.CLAIMED;
        }));
    }

    @Override
    public void setDriverAvailability(long driverId, boolean available) {
        int updated = translate("setDriverAvailability",
                () -> transactionTemplate.execute(status -> driverProfileRepository.updateAvailability(driverId, available)));
        if (updated == 0) {
            log.warn("No driver profile {} to mark available={}", driverId, available);
        }
    }

    @Override
    public boolean confirmClaim(long requestId, long driverId) {
        return translate("confirmClaim", () -> transactionTemplate.execute(status ->
                deliveryRequestRepository.transitionForDriver(
                        requestId, driverId, ClaimStatus.CLAIMED, ClaimStatus.ACCEPTED) == 1));
    }

    @Override
    public boolean releaseClaim(long requestId, long driverId) {
        return translate("releaseClaim", () -> transactionTemplate.execute(status ->
                deliveryRequestRepository.releaseIfHeldBy(
                        requestId, driverId, List.of(ClaimStatus.CLAIMED), ClaimStatus.UNASSIGNED) == 1));
    }

    @Override
    public boolean releaseAssignment(long requestId, long driverId) {
        return translate("releaseAssignment", () -> transactionTemplate.execute(status ->
                deliveryRequestRepository.releaseIfHeldBy(requestId, driverId,
                        List.of(ClaimStatus.CLAIMED, ClaimStatus.ACCEPTED), ClaimStatus.UNASSIGNED) == 1));
    }

    @Override
    public Optional<DeliveryRequestView> findRequest(long requestId) {
        return translate("findRequest", () -> deliveryRequestRepository.findById(requestId).map(this::toView));
    }

    @Override
    public List<DeliveryRequestView> findRecentUnassigned(int limit) {
        return translate("findRecentUnassigned", () -> deliveryRequestRepository
                .findByStatusAndDriverIdIsNullOrderByCreatedAtDesc(ClaimStatus.UNASSIGNED, PageRequest.of(0, limit))
                .stream()
                .map(this::toView)
                .toList());
    }

    @Override
    public Optional<DriverCandidate> findDriver(long driverId) {
        return translate("findDriver", () -> driverProfileRepository.findById(driverId).map(this::toCandidate));
    }

    @Override
    public void updateDriverLocation(long driverId, GeoPoint location) {
        int updated = translate("updateDriverLocation", () -> transactionTemplate.execute(status ->
                driverProfileRepository.updateLocation(driverId, location.latitude(), location.longitude(), clock.instant())));
        if (updated == 0) {
            log.debug("Location update for unknown driver {}", driverId);
        }
    }

    // --- helpers ---

    private <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (TransientDataAccessException | RecoverableDataAccessException
                 | DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new TransientStorageException("Storage operation " + operation + " failed", e);
        }
    }

    private DriverCandidate toCandidate(DriverProfile profile) {
        return DriverCandidate.builder()
                .driverId(profile.getUserId())
                .location(GeoPoint.ofNullable(profile.getLatitude(), profile.getLongitude()))
                .rating(profile.getRating())
                .completedJobs(profile.getCompletedJobs())
                .averageCompletionMinutes(profile.getAverageCompletionMinutes())
                .online(profile.isOnline())
                .available(profile.isAvailable())
                .verified(profile.getVerificationStatus() == VerificationStatus.VERIFIED)
                .build();
    }

    private DeliveryRequestView toView(DeliveryRequest request) {
        return new DeliveryRequestView(
                request.getId(),
                request.getRequesterId(),
                GeoPoint.of(request.getPickupLat(), request.getPickupLng()),
                GeoPoint.of(request.getDropoffLat(), request.getDropoffLng()),
                request.getStatus(),
                request.getDriverId(),
                request.getCreatedAt(),
                request.getClaimedAt());
    }
}
