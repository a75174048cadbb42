package com.deliverydispatch.dispatch.connection;

import com.deliverydispatch.dispatch.model.ConnectionMetricsView;
import com.deliverydispatch.shared.enums.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative in-process index of open sockets, by connection id, user and role.
 *
 * Binding changes are published as {@link ConnectionAddedEvent} / {@link ConnectionRemovedEvent}
 * so presence can be re-evaluated without the registry knowing who listens.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();
    private final Map<Long, Set<String>> connectionsByUser = new ConcurrentHashMap<>();
    private final Map<UserRole, Set<String>> connectionsByRole = new ConcurrentHashMap<>();

    /**
     * Registers the connection, or refreshes its user/role indexes if it is already known.
     */
    public void add(Connection connection) {
        String connectionId = connection.getConnectionId();
        connections.put(connectionId, connection);

        Binding next = Binding.of(connection);
        Binding previous = next == null ? bindings.get(connectionId) : bindings.put(connectionId, next);
        if (next == null || Objects.equals(previous, next)) {
            return;
        }

        unindex(connectionId, previous);
        index(connectionId, next);
        log.info("Connection {} bound to user {} ({})", connectionId, next.userId(), next.role());
        eventPublisher.publishEvent(new ConnectionAddedEvent(connection));
    }

    public Connection bindUser(String connectionId, long userId, UserRole role) {
        Connection connection = get(connectionId)
                .orElseThrow(() -> new IllegalStateException("Unknown connection " + connectionId));
        connection.bindUser(userId, role);
        add(connection);
        return connection;
    }

    public Optional<Connection> remove(String connectionId) {
        Connection connection = connections.remove(connectionId);
        if (connection == null) {
            return Optional.empty();
        }
        Binding binding = bindings.remove(connectionId);
        unindex(connectionId, binding);
        if (binding != null) {
            log.info("Connection {} of user {} removed", connectionId, binding.userId());
            eventPublisher.publishEvent(new ConnectionRemovedEvent(connection));
        } else {
            log.debug("Anonymous connection {} removed", connectionId);
        }
        return Optional.of(connection);
    }

    public void touch(String connectionId) {
        Connection connection = connections.get(connectionId);
        if (connection != null) {
            connection.markActive(clock.instant());
        }
    }

    public Optional<Connection> get(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Set<String> connectionsFor(long userId) {
        return Set.copyOf(connectionsByUser.getOrDefault(userId, Set.of()));
    }

    public Set<String> connectionsForRole(UserRole role) {
        return Set.copyOf(connectionsByRole.getOrDefault(role, Set.of()));
    }

    public boolean isOnline(long userId) {
        Set<String> ids = connectionsByUser.get(userId);
        return ids != null && !ids.isEmpty();
    }

    public List<Connection> snapshot() {
        return List.copyOf(connections.values());
    }

    public List<Connection> authenticatedConnections() {
        return connections.values().stream().filter(Connection::isAuthenticated).toList();
    }

    public Collection<Long> onlineUsers() {
        return Set.copyOf(connectionsByUser.keySet());
    }

    public int activeConnectionCount() {
        return connections.size();
    }

    public int onlineUserCount() {
        return connectionsByUser.size();
    }

    public ConnectionMetricsView metrics() {
        Map<UserRole, Integer> byRole = new EnumMap<>(UserRole.class);
        for (UserRole role : UserRole.values()) {
            byRole.put(role, connectionsByRole.getOrDefault(role, Set.of()).size());
        }
        return new ConnectionMetricsView(activeConnectionCount(), onlineUserCount(), byRole);
    }

    // --- helpers ---

    private void index(String connectionId, Binding binding) {
        connectionsByUser.computeIfAbsent(binding.userId(), k -> ConcurrentHashMap.newKeySet()).add(connectionId);
        connectionsByRole.computeIfAbsent(binding.role(), k -> ConcurrentHashMap.newKeySet()).add(connectionId);
    }

    private void unindex(String connectionId, Binding binding) {
        if (binding == null) {
            return;
        }
        connectionsByUser.computeIfPresent(binding.userId(), (k, ids) -> {
            ids.remove(connectionId);
            return ids.isEmpty() ? null : ids;
        });
        connectionsByRole.computeIfPresent(binding.role(), (k, ids) -> {
            ids.remove(connectionId);
            return ids.isEmpty() ? null : ids;
        });
    }

    private record Binding(long userId, UserRole role) {

        static Binding of(Connection connection) {
            Long userId = connection.getUserId();
            return userId == null ? null : new Binding(userId, connection.getRole());
        }
    }
}
