package com.deliverydispatch.dispatch.queue;

import com.deliverydispatch.dispatch.config.DispatchProperties;
import com.deliverydispatch.dispatch.metrics.DispatchMetrics;
import com.deliverydispatch.dispatch.model.OutboundEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Holds events for users without a live socket until their next authentication.
 * Enqueue never blocks or fails; expired messages are dropped on drain and by the hourly purge.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OfflineMessageQueue {

    private final QueueStore queueStore;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;

    public QueuedMessage enqueue(long userId, OutboundEvent event) {
        Instant now = clock.instant();
        QueuedMessage message = new QueuedMessage(
                UUID.randomUUID().toString(),
                userId,
                event.type(),
                event.data(),
                now,
                now.plus(properties.getQueue().getMessageTtl()));
        queueStore.append(message);
        metrics.recordMessageQueued();
        log.debug("Queued {} for offline user {}", event.type(), userId);
        return message;
    }

    /**
     * Returns the user's unexpired messages in the order they were queued and empties the queue.
     */
    public List<QueuedMessage> drainAndClear(long userId) {
        Instant now = clock.instant();
        List<QueuedMessage> drained = queueStore.drain(userId);
        List<QueuedMessage> live = drained.stream()
                .filter(m -> !m.isExpiredAt(now))
                .toList();

        int expired = drained.size() - live.size();
        if (expired > 0) {
            metrics.recordMessagesExpired(expired);
        }
        if (!live.isEmpty()) {
            metrics.recordMessagesFlushed(live.size());
            log.info("Drained {} queued messages for user {} ({} expired)", live.size(), userId, expired);
        }
        return live;
    }

    @Scheduled(fixedDelayString = "${dispatch.queue.purge-interval-ms:3600000}")
    public void purgeExpired() {
        int removed = queueStore.purgeExpired(clock.instant());
        if (removed > 0) {
            metrics.recordMessagesExpired(removed);
            log.info("Purged {} expired queued messages", removed);
        }
    }
}
