package com.deliverydispatch.dispatch.repository;

import com.deliverydispatch.dispatch.entity.DeliveryRequest;
import com.deliverydispatch.shared.enums.ClaimStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface DeliveryRequestRepository extends JpaRepository<DeliveryRequest, Long> {

    List<DeliveryRequest> findByStatusAndDriverIdIsNullOrderByCreatedAtDesc(ClaimStatus status, Pageable pageable);

    /**
     * Attaches a driver only while no driver is attached. Exactly one concurrent caller wins.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DeliveryRequest r SET r.driverId = :driverId, r.status = :claimed, r.claimedAt = :claimedAt "
            + "WHERE r.id = :id AND r.driverId IS NULL AND r.status = :unassigned")
    int claimIfUnassigned(Long id, Long driverId, ClaimStatus claimed, ClaimStatus unassigned, Instant claimedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DeliveryRequest r SET r.status = :next WHERE r.id = :id AND r.driverId = :driverId AND r.status = :current")
    int transitionForDriver(Long id, Long driverId, ClaimStatus current, ClaimStatus next);

    /**
     * Detaches the driver if they still hold the request in one of the {@code held} statuses.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DeliveryRequest r SET r.driverId = NULL, r.claimedAt = NULL, r.status = :unassigned "
            + "WHERE r.id = :id AND r.driverId = :driverId AND r.status IN :held")
    int releaseIfHeldBy(Long id, Long driverId, Collection<ClaimStatus> held, ClaimStatus unassigned);
}
