package com.deliverydispatch.dispatch.service;

import com.deliverydispatch.dispatch.config.DispatchProperties;
import com.deliverydispatch.dispatch.config.ResilienceConfig;
import com.deliverydispatch.dispatch.storage.DispatchStorage;
import com.deliverydispatch.shared.events.DriverLocationUpdatedEvent;
import com.deliverydispatch.shared.model.GeoPoint;
import com.deliverydispatch.shared.util.GeoUtil;
import com.deliverydispatch.shared.util.KafkaTopics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LocationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    @Mock private DispatchStorage storage;
    @Mock private KafkaTemplate<String, Object> kafkaTemplate;

    private LocationService service;

    @BeforeEach
    void setUp() {
        service = new LocationService(storage, kafkaTemplate,
                new ResilienceConfig().storageRetry(new DispatchProperties()), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Location is stored and published with its dispatch cell")
    void storesAndPublishes() {
        GeoPoint point = GeoPoint.of(6.5244, 3.3792);

        DriverLocationUpdatedEvent event = service.updateLocation(11L, point, 90.0, 30.0);

        verify(storage).updateDriverLocation(11L, point);
        verify(kafkaTemplate).send(KafkaTopics.DRIVER_LOCATION_UPDATED, "11", event);
        assertThat(event.getDispatchCell()).isEqualTo(GeoUtil.dispatchCell(6.5244, 3.3792));
        assertThat(event.getTimestamp()).isEqualTo(NOW);
        assertThat(event.getHeading()).isEqualTo(90.0);
    }

    @Test
    @DisplayName("A broker failure does not fail the location update")
    void brokerFailureTolerated() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("broker down"));

        service.updateLocation(11L, GeoPoint.of(6.5, 3.3), null, null);

        verify(storage).updateDriverLocation(11L, GeoPoint.of(6.5, 3.3));
    }
}
