package com.deliverydispatch.dispatch.connection;

import com.deliverydispatch.dispatch.model.OutboundEvent;
import com.deliverydispatch.shared.enums.UserRole;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One live client socket. The user id is set once, on authentication, and never changes.
 *
 * Live traffic can be held back while a queued-message flush is in progress: {@link #send}
 * buffers until {@link #releaseLiveTraffic()}, whereas {@link #reply} always goes straight out.
 */
@Slf4j
@Getter
public class Connection {

    private final String connectionId;
    private final ConnectionChannel channel;
    private final Instant establishedAt;

    private volatile Long userId;
    private volatile UserRole role;
    private volatile Instant lastActivityAt;
    private volatile Instant probeSentAt;
    private volatile String reconnectToken;
    private volatile int reconnectCount;

    private boolean holdingLiveTraffic;
    private final List<OutboundEvent> heldEvents = new ArrayList<>();

    public Connection(String connectionId, ConnectionChannel channel, Instant establishedAt) {
        this.connectionId = connectionId;
        this.channel = channel;
        this.establishedAt = establishedAt;
        this.lastActivityAt = establishedAt;
    }

    public synchronized void bindUser(long userId, UserRole role) {
        if (this.userId != null && this.userId != userId) {
            throw new IllegalStateException("Connection " + connectionId + " is already bound to user " + this.userId);
        }
        this.userId = userId;
        this.role = role;
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    public void markActive(Instant now) {
        this.lastActivityAt = now;
        this.probeSentAt = null;
    }

    public void markProbed(Instant now) {
        this.probeSentAt = now;
    }

    public void recordReconnectToken(String token, boolean resumed) {
        this.reconnectToken = token;
        if (resumed) {
            reconnectCount++;
        }
    }

    /**
     * Pushes live traffic. Returns false if the socket is gone or the write failed.
     */
    public synchronized boolean send(OutboundEvent event) {
        if (holdingLiveTraffic) {
            heldEvents.add(event);
            return true;
        }
        return write(event);
    }

    /**
     * Direct response to something this connection asked for; never held back.
     */
    public synchronized boolean reply(OutboundEvent event) {
        return write(event);
    }

    public synchronized void holdLiveTraffic() {
        holdingLiveTraffic = true;
    }

    public synchronized void releaseLiveTraffic() {
        holdingLiveTraffic = false;
        for (OutboundEvent event : heldEvents) {
            write(event);
        }
        heldEvents.clear();
    }

    public void close(String reason) {
        try {
            channel.close(reason);
        } catch (IOException e) {
            log.debug("Closing connection {} failed: {}", connectionId, e.getMessage());
        }
    }

    private boolean write(OutboundEvent event) {
        if (!channel.isOpen()) {
            return false;
        }
        try {
            channel.send(event);
            return true;
        } catch (IOException | IllegalStateException e) {
            log.warn("Dropped {} for connection {}: {}", event.type(), connectionId, e.getMessage());
            return false;
        }
    }
}
