package com.deliverydispatch.dispatch.connection;

import com.deliverydispatch.dispatch.config.DispatchProperties;
import com.deliverydispatch.dispatch.metrics.DispatchMetrics;
import com.deliverydispatch.dispatch.model.EventTypes;
import com.deliverydispatch.dispatch.support.MutableClock;
import com.deliverydispatch.dispatch.support.RecordingChannel;
import com.deliverydispatch.shared.enums.UserRole;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class ConnectionSweeperTest {

    private static final Instant START = Instant.parse("2026-03-01T08:00:00Z");

    @Mock private ApplicationEventPublisher eventPublisher;

    private MutableClock clock;
    private ConnectionRegistry registry;
    private SimpleMeterRegistry meterRegistry;
    private ConnectionSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        registry = new ConnectionRegistry(eventPublisher, clock);
        meterRegistry = new SimpleMeterRegistry();
        sweeper = new ConnectionSweeper(registry, new DispatchProperties(), new DispatchMetrics(meterRegistry), clock);
    }

    @Test
    @DisplayName("Recently active connections are left alone")
    void activeConnectionUntouched() {
        RecordingChannel channel = open("c1");

        clock.advance(Duration.ofMinutes(4));
        sweeper.sweep();

        assertThat(channel.sent()).isEmpty();
        assertThat(channel.isOpen()).isTrue();
    }

    @Test
    @DisplayName("Idle connections are probed with a ping")
    void idleConnectionProbed() {
        RecordingChannel channel = open("c1");

        clock.advance(Duration.ofMinutes(5));
        sweeper.sweep();

        assertThat(channel.sentTypes()).containsExactly(EventTypes.PING);
        assertThat(registry.get("c1").orElseThrow().getProbeSentAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("A probed connection that answers is kept")
    void answeredProbeKeepsConnection() {
        RecordingChannel channel = open("c1");
        clock.advance(Duration.ofMinutes(5));
        sweeper.sweep();

        clock.advance(Duration.ofSeconds(30));
        registry.touch("c1");
        clock.advance(Duration.ofSeconds(40));
        sweeper.sweep();

        assertThat(channel.isOpen()).isTrue();
        assertThat(registry.get("c1")).isPresent();
    }

    @Test
    @DisplayName("A probed connection that stays silent is closed and removed")
    void silentConnectionClosed() {
        RecordingChannel channel = open("c1");
        registry.bindUser("c1", 9L, UserRole.DRIVER);
        clock.advance(Duration.ofMinutes(5));
        sweeper.sweep();

        clock.advance(Duration.ofSeconds(60));
        sweeper.sweep();

        assertThat(channel.isOpen()).isFalse();
        assertThat(channel.closeReason()).isEqualTo("idle timeout");
        assertThat(registry.get("c1")).isEmpty();
        assertThat(registry.isOnline(9L)).isFalse();
        assertThat(meterRegistry.get("dispatch.connections_closed").counter().count()).isEqualTo(1.0);
    }

    private RecordingChannel open(String id) {
        RecordingChannel channel = new RecordingChannel();
        registry.add(new Connection(id, channel, clock.instant()));
        return channel;
    }
}
