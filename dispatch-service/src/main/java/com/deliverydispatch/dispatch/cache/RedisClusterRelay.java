package com.deliverydispatch.dispatch.cache;

import com.deliverydispatch.dispatch.model.OutboundEvent;
import com.deliverydispatch.shared.enums.PresenceStatus;
import com.deliverydispatch.shared.enums.UserRole;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Publishes presence transitions and cross-instance deliveries over Redis pub/sub.
 * Peers pick them up in {@link ClusterRelaySubscriber}.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisClusterRelay implements ClusterRelay {

    public static final String PRESENCE_CHANNEL = "dispatch:presence";
    public static final String DELIVER_CHANNEL = "dispatch:deliver";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final CacheFallback cacheFallback;
    private final String instanceId;

    @Override
    public void publishPresence(long userId, UserRole role, PresenceStatus status) {
        publish(PRESENCE_CHANNEL, new PresenceRelayMessage(instanceId, userId, role, status));
    }

    @Override
    public void relayToUser(long userId, OutboundEvent event) {
        publish(DELIVER_CHANNEL, new DeliveryRelayMessage(instanceId, userId, null, event));
    }

    @Override
    public void relayToRole(UserRole role, OutboundEvent event) {
        publish(DELIVER_CHANNEL, new DeliveryRelayMessage(instanceId, null, role, event));
    }

    private void publish(String channel, Object message) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Could not serialise relay message for {}", channel, e);
            return;
        }
        cacheFallback.run("relay." + channel,
                () -> redisTemplate.convertAndSend(channel, payload),
                () -> log.debug("Relay on {} skipped while Redis is down", channel));
    }
}
