package com.deliverydispatch.dispatch.metrics;

import com.deliverydispatch.dispatch.connection.ConnectionRegistry;
import com.deliverydispatch.shared.enums.UserRole;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Live gauges over the connection registry.
 */
@Component
@RequiredArgsConstructor
public class ConnectionMetricsBinder implements MeterBinder {

    private final ConnectionRegistry connectionRegistry;

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("dispatch.connections.active", connectionRegistry, ConnectionRegistry::activeConnectionCount)
                .description("Open dispatch sockets on this instance")
                .register(registry);
        Gauge.builder("dispatch.users.online", connectionRegistry, ConnectionRegistry::onlineUserCount)
                .description("Distinct authenticated users with at least one socket")
                .register(registry);
        for (UserRole role : UserRole.values()) {
            Gauge.builder("dispatch.connections.by_role", connectionRegistry, r -> r.connectionsForRole(role).size())
                    .tag("role", role.name().toLowerCase())
                    .register(registry);
        }
    }
}
