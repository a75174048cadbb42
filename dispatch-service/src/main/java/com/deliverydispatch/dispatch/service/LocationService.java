package com.deliverydispatch.dispatch.service;

import com.deliverydispatch.dispatch.storage.DispatchStorage;
import com.deliverydispatch.shared.events.DriverLocationUpdatedEvent;
import com.deliverydispatch.shared.model.GeoPoint;
import com.deliverydispatch.shared.util.GeoUtil;
import com.deliverydispatch.shared.util.KafkaTopics;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Records driver positions reported over the socket and republishes them, tagged with
 * their dispatch cell, for downstream consumers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocationService {

    private final DispatchStorage storage;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Retry storageRetry;
    private final Clock clock;

    public DriverLocationUpdatedEvent updateLocation(long driverId, GeoPoint location, Double heading, Double speed) {
        storageRetry.executeRunnable(() -> storage.updateDriverLocation(driverId, location));

        DriverLocationUpdatedEvent event = DriverLocationUpdatedEvent.builder()
                .driverId(driverId)
                .latitude(location.latitude())
                .longitude(location.longitude())
                .heading(heading)
                .speed(speed)
                .dispatchCell(GeoUtil.dispatchCell(location.latitude(), location.longitude()))
                .timestamp(Instant.now(clock))
                .build();

        try {
            kafkaTemplate.send(KafkaTopics.DRIVER_LOCATION_UPDATED, String.valueOf(driverId), event);
        } catch (RuntimeException e) {
            log.warn("Could not publish location of driver {}: {}", driverId, e.getMessage());
        }
        log.debug("Location updated for driver {} at ({},{})", driverId, location.latitude(), location.longitude());
        return event;
    }
}
