package com.deliverydispatch.dispatch.connection;

/**
 * Published when an authenticated connection leaves the registry.
 */
public record ConnectionRemovedEvent(Connection connection) {
}
