package com.deliverydispatch.dispatch.connection;

import com.deliverydispatch.dispatch.model.ConnectionMetricsView;
import com.deliverydispatch.dispatch.support.MutableClock;
import com.deliverydispatch.dispatch.support.RecordingChannel;
import com.deliverydispatch.shared.enums.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ConnectionRegistryTest {

    private static final Instant START = Instant.parse("2026-03-01T08:00:00Z");

    @Mock private ApplicationEventPublisher eventPublisher;

    private MutableClock clock;
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        registry = new ConnectionRegistry(eventPublisher, clock);
    }

    @Test
    @DisplayName("Anonymous connections are counted but not indexed or announced")
    void anonymousConnection() {
        registry.add(connection("c1"));

        assertThat(registry.activeConnectionCount()).isEqualTo(1);
        assertThat(registry.onlineUserCount()).isZero();
        assertThat(registry.authenticatedConnections()).isEmpty();
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("Binding a user indexes the connection by user and role and announces it")
    void bindIndexesAndPublishes() {
        registry.add(connection("c1"));

        registry.bindUser("c1", 11L, UserRole.DRIVER);

        assertThat(registry.connectionsFor(11L)).containsExactly("c1");
        assertThat(registry.connectionsForRole(UserRole.DRIVER)).containsExactly("c1");
        assertThat(registry.isOnline(11L)).isTrue();
        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue()).isInstanceOf(ConnectionAddedEvent.class);
    }

    @Test
    @DisplayName("Re-adding an already bound connection is a no-op")
    void addIsIdempotent() {
        Connection c1 = connection("c1");
        registry.add(c1);
        registry.bindUser("c1", 11L, UserRole.DRIVER);

        registry.add(c1);
        registry.add(c1);

        assertThat(registry.connectionsFor(11L)).containsExactly("c1");
        verify(eventPublisher, times(1)).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("A user stays online until their last connection is removed")
    void twoConnectionsOneUser() {
        registry.add(connection("c1"));
        registry.add(connection("c2"));
        registry.bindUser("c1", 11L, UserRole.CONSUMER);
        registry.bindUser("c2", 11L, UserRole.CONSUMER);

        registry.remove("c1");
        assertThat(registry.isOnline(11L)).isTrue();
        assertThat(registry.connectionsFor(11L)).containsExactly("c2");

        registry.remove("c2");
        assertThat(registry.isOnline(11L)).isFalse();
        assertThat(registry.onlineUsers()).isEmpty();
        assertThat(registry.connectionsForRole(UserRole.CONSUMER)).isEmpty();
    }

    @Test
    @DisplayName("Removing an unknown connection does nothing")
    void removeUnknown() {
        assertThat(registry.remove("missing")).isEmpty();
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("A connection cannot be rebound to a different user")
    void rebindRejected() {
        registry.add(connection("c1"));
        registry.bindUser("c1", 11L, UserRole.DRIVER);

        assertThatThrownBy(() -> registry.bindUser("c1", 12L, UserRole.DRIVER))
                .isInstanceOf(IllegalStateException.class);
        assertThat(registry.connectionsFor(12L)).isEmpty();
    }

    @Test
    @DisplayName("Touch refreshes activity and clears a pending probe")
    void touchMarksActive() {
        Connection c1 = connection("c1");
        registry.add(c1);
        c1.markProbed(START);

        clock.advance(Duration.ofMinutes(2));
        registry.touch("c1");

        assertThat(c1.getLastActivityAt()).isEqualTo(START.plus(Duration.ofMinutes(2)));
        assertThat(c1.getProbeSentAt()).isNull();
    }

    @Test
    @DisplayName("Metrics report connections, distinct users and per-role counts")
    void metrics() {
        registry.add(connection("c1"));
        registry.add(connection("c2"));
        registry.add(connection("c3"));
        registry.add(connection("anon"));
        registry.bindUser("c1", 1L, UserRole.DRIVER);
        registry.bindUser("c2", 1L, UserRole.DRIVER);
        registry.bindUser("c3", 2L, UserRole.ADMIN);

        ConnectionMetricsView view = registry.metrics();

        assertThat(view.activeConnections()).isEqualTo(4);
        assertThat(view.onlineUsers()).isEqualTo(2);
        assertThat(view.connectionsByRole())
                .containsEntry(UserRole.DRIVER, 2)
                .containsEntry(UserRole.ADMIN, 1)
                .containsEntry(UserRole.CONSUMER, 0);
    }

    private Connection connection(String id) {
        return new Connection(id, new RecordingChannel(), clock.instant());
    }
}
