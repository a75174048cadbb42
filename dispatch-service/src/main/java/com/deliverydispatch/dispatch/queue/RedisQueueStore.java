package com.deliverydispatch.dispatch.queue;

import com.deliverydispatch.dispatch.cache.CacheFallback;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Redis list per user, appended with RPUSH so LRANGE returns insertion order.
 *
 * Key pattern:  msg_queue:{userId}  (expires with the newest message's TTL)
 *
 * Messages appended while Redis was down sit in the in-memory fallback and are merged back
 * in on the next drain.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisQueueStore implements QueueStore {

    private static final String QUEUE_KEY_PREFIX = "msg_queue:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final InMemoryQueueStore fallback;
    private final CacheFallback cacheFallback;

    @Override
    public void append(QueuedMessage message) {
        String key = QUEUE_KEY_PREFIX + message.userId();
        String json = toJson(message);
        Duration ttl = Duration.between(message.enqueuedAt(), message.expiresAt());
        cacheFallback.run("queue.append", () -> {
            redisTemplate.opsForList().rightPush(key, json);
            redisTemplate.expire(key, ttl);
        }, () -> fallback.append(message));
    }

    @Override
    public List<QueuedMessage> drain(long userId) {
        String key = QUEUE_KEY_PREFIX + userId;
        List<String> raw = cacheFallback.call("queue.drain", () -> popAll(key), List::of);

        List<QueuedMessage> drained = new ArrayList<>(fallback.drain(userId));
        for (String json : raw) {
            try {
                drained.add(objectMapper.readValue(json, QueuedMessage.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable queued message for user {}: {}", userId, e.getOriginalMessage());
            }
        }
        drained.sort(Comparator.comparing(QueuedMessage::enqueuedAt));
        return drained;
    }

    @Override
    public int purgeExpired(Instant now) {
        // Redis lists expire as a whole; stale entries inside a live list are filtered on drain.
        return fallback.purgeExpired(now);
    }

    // --- helpers ---

    @SuppressWarnings("unchecked")
    private List<String> popAll(String key) {
        List<Object> results = redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForList().range(key, 0, -1);
                ops.delete(key);
                return ops.exec();
            }
        });
        if (results == null || results.isEmpty() || results.get(0) == null) {
            return List.of();
        }
        return (List<String>) results.get(0);
    }

    private String toJson(QueuedMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Queued message " + message.messageId() + " is not serialisable", e);
        }
    }
}
