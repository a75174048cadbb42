package com.deliverydispatch.dispatch.cache;

import com.deliverydispatch.dispatch.presence.PresenceBroadcaster;
import com.deliverydispatch.dispatch.service.NotificationRouter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;

import java.nio.charset.StandardCharsets;

/**
 * Receives relay traffic from peer instances and hands it to the local audience.
 * Messages this instance published itself are ignored.
 */
@Slf4j
@RequiredArgsConstructor
public class ClusterRelaySubscriber implements MessageListener {

    private final ObjectMapper objectMapper;
    private final NotificationRouter notificationRouter;
    private final PresenceBroadcaster presenceBroadcaster;
    private final String instanceId;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        String body = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            switch (channel) {
                case RedisClusterRelay.PRESENCE_CHANNEL -> {
                    PresenceRelayMessage presence = objectMapper.readValue(body, PresenceRelayMessage.class);
                    if (!instanceId.equals(presence.origin())) {
                        presenceBroadcaster.onRemoteTransition(presence);
                    }
                }
                case RedisClusterRelay.DELIVER_CHANNEL -> {
                    DeliveryRelayMessage delivery = objectMapper.readValue(body, DeliveryRelayMessage.class);
                    if (!instanceId.equals(delivery.origin())) {
                        notificationRouter.deliverRelayed(delivery);
                    }
                }
                default -> log.debug("Ignoring message on unexpected channel {}", channel);
            }
        } catch (JsonProcessingException e) {
            log.warn("Unreadable relay message on {}: {}", channel, e.getOriginalMessage());
        }
    }
}
