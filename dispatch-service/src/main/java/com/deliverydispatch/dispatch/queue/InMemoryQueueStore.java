package com.deliverydispatch.dispatch.queue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryQueueStore implements QueueStore {

    private final Map<Long, List<QueuedMessage>> queues = new ConcurrentHashMap<>();

    @Override
    public void append(QueuedMessage message) {
        queues.compute(message.userId(), (userId, messages) -> {
            List<QueuedMessage> list = messages == null ? new ArrayList<>() : messages;
            list.add(message);
            return list;
        });
    }

    @Override
    public List<QueuedMessage> drain(long userId) {
        List<QueuedMessage> drained = queues.remove(userId);
        return drained == null ? List.of() : List.copyOf(drained);
    }

    @Override
    public int purgeExpired(Instant now) {
        AtomicInteger removed = new AtomicInteger();
        for (Long userId : queues.keySet()) {
            queues.computeIfPresent(userId, (k, messages) -> {
                int before = messages.size();
                messages.removeIf(m -> m.isExpiredAt(now));
                removed.addAndGet(before - messages.size());
                return messages.isEmpty() ? null : messages;
            });
        }
        return removed.get();
    }
}
