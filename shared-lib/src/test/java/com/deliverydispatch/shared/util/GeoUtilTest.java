package com.deliverydispatch.shared.util;

import com.deliverydispatch.shared.model.GeoPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoUtilTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    @DisplayName("Distance from a point to itself is zero")
    void distanceToSelfIsZero() {
        assertThat(GeoUtil.distanceKm(40.7128, -74.0060, 40.7128, -74.0060)).isZero();
    }

    @Test
    @DisplayName("Distance is symmetric")
    void distanceIsSymmetric() {
        GeoPoint a = GeoPoint.of(51.5074, -0.1278);
        GeoPoint b = GeoPoint.of(48.8566, 2.3522);
        assertThat(GeoUtil.distanceKm(a, b)).isEqualTo(GeoUtil.distanceKm(b, a));
    }

    @Test
    @DisplayName("One degree of latitude is about 111.19 km on a 6371 km sphere")
    void oneDegreeOfLatitude() {
        assertThat(GeoUtil.distanceKm(0.0, 0.0, 1.0, 0.0)).isCloseTo(111.195, within(0.01));
    }

    @Test
    @DisplayName("London to Paris is roughly 344 km")
    void londonToParis() {
        double km = GeoUtil.distanceKm(51.5074, -0.1278, 48.8566, 2.3522);
        assertThat(km).isCloseTo(343.5, within(1.0));
    }

    @Test
    @DisplayName("ETA is linear in distance at the assumed speed")
    void etaIsLinear() {
        assertThat(GeoUtil.etaMinutes(10.0, 60.0)).isCloseTo(10.0, within(1e-9));
        assertThat(GeoUtil.etaMinutes(20.0, 60.0)).isCloseTo(20.0, within(1e-9));
    }

    @Test
    @DisplayName("ETA applies a 5 km/h speed floor")
    void etaSpeedFloor() {
        assertThat(GeoUtil.etaMinutes(1.0, 0.0)).isCloseTo(12.0, within(1e-9));
        assertThat(GeoUtil.etaMinutes(1.0, 2.0)).isCloseTo(12.0, within(1e-9));
    }

    @Test
    @DisplayName("Arrival estimate adds a two-minutes-per-km buffer to urban travel time")
    void estimatedArrivalAddsBuffer() {
        // 2 km: 4.8 min travel + 4 min buffer
        Instant eta = GeoUtil.estimatedArrival(2.0, NOW);
        assertThat(Duration.between(NOW, eta)).isEqualTo(Duration.ofSeconds(528));
    }

    @Test
    @DisplayName("Arrival buffer is capped at fifteen minutes")
    void estimatedArrivalBufferCapped() {
        // 20 km: 48 min travel + 15 min capped buffer
        Instant eta = GeoUtil.estimatedArrival(20.0, NOW);
        assertThat(Duration.between(NOW, eta)).isEqualTo(Duration.ofMinutes(63));
    }

    @Test
    @DisplayName("Dispatch cell is stable for the same coordinate")
    void dispatchCellIsStable() {
        String cell = GeoUtil.dispatchCell(37.7749, -122.4194);
        assertThat(cell).isNotBlank();
        assertThat(GeoUtil.dispatchCell(37.7749, -122.4194)).isEqualTo(cell);
    }
}
