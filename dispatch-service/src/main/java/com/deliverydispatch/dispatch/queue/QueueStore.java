package com.deliverydispatch.dispatch.queue;

import java.time.Instant;
import java.util.List;

public interface QueueStore {

    void append(QueuedMessage message);

    /** Removes and returns everything held for the user, oldest first. */
    List<QueuedMessage> drain(long userId);

    /** Drops expired messages; returns how many were removed. */
    int purgeExpired(Instant now);
}
