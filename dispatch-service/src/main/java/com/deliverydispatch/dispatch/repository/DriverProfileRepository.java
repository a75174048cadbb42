package com.deliverydispatch.dispatch.repository;

import com.deliverydispatch.dispatch.entity.DriverProfile;
import com.deliverydispatch.shared.enums.VerificationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface DriverProfileRepository extends JpaRepository<DriverProfile, Long> {

    List<DriverProfile> findByOnlineTrueAndAvailableTrueAndVerificationStatus(VerificationStatus verificationStatus);

    /**
     * Compare-and-set on availability: succeeds (returns 1) only for the caller that flips it.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DriverProfile d SET d.available = false WHERE d.userId = :driverId AND d.available = true")
    int reserveIfAvailable(Long driverId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DriverProfile d SET d.available = :available WHERE d.userId = :driverId")
    int updateAvailability(Long driverId, boolean available);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DriverProfile d SET d.latitude = :latitude, d.longitude = :longitude, "
            + "d.locationUpdatedAt = :updatedAt WHERE d.userId = :driverId")
    int updateLocation(Long driverId, double latitude, double longitude, Instant updatedAt);
}
