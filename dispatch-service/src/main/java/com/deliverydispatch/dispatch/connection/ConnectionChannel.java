package com.deliverydispatch.dispatch.connection;

import com.deliverydispatch.dispatch.model.OutboundEvent;

import java.io.IOException;

/**
 * Outbound half of a client socket.
 */
public interface ConnectionChannel {

    void send(OutboundEvent event) throws IOException;

    void close(String reason) throws IOException;

    boolean isOpen();
}
