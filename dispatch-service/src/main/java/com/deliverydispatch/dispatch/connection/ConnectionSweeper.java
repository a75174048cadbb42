package com.deliverydispatch.dispatch.connection;

import com.deliverydispatch.dispatch.config.DispatchProperties;
import com.deliverydispatch.dispatch.metrics.DispatchMetrics;
import com.deliverydispatch.dispatch.model.EventTypes;
import com.deliverydispatch.dispatch.model.OutboundEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Probes idle sockets and closes the ones that stay silent.
 *
 * A connection idle for {@code probe-after} gets a {@code ping}. Any inbound frame clears the
 * probe; if none arrives within {@code probe-timeout} the connection is removed and closed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionSweeper {

    private final ConnectionRegistry connectionRegistry;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${dispatch.socket.sweep-interval-ms:30000}")
    public void sweep() {
        Instant now = clock.instant();
        Duration probeAfter = properties.getSocket().getProbeAfter();
        Duration probeTimeout = properties.getSocket().getProbeTimeout();
        int probed = 0;
        int closed = 0;

        for (Connection connection : connectionRegistry.snapshot()) {
            Instant probeSentAt = connection.getProbeSentAt();
            if (probeSentAt != null) {
                if (!now.isBefore(probeSentAt.plus(probeTimeout))) {
                    forceClose(connection);
                    closed++;
                }
            } else if (!now.isBefore(connection.getLastActivityAt().plus(probeAfter))) {
                connection.markProbed(now);
                connection.reply(OutboundEvent.builder(EventTypes.PING)
                        .put("serverTime", now.toString())
                        .build());
                probed++;
            }
        }

        if (probed > 0 || closed > 0) {
            log.info("Liveness sweep: {} probed, {} closed, {} open", probed, closed,
                    connectionRegistry.activeConnectionCount());
        }
    }

    private void forceClose(Connection connection) {
        log.info("Closing idle connection {} (user {})", connection.getConnectionId(), connection.getUserId());
        connectionRegistry.remove(connection.getConnectionId());
        connection.close("idle timeout");
        metrics.recordIdleClose();
    }
}
