package com.deliverydispatch.dispatch.connection;

/**
 * Published when a connection becomes associated with a user.
 */
public record ConnectionAddedEvent(Connection connection) {
}
