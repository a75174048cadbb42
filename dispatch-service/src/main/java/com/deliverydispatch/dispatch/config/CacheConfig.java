package com.deliverydispatch.dispatch.config;

import com.deliverydispatch.dispatch.cache.CacheFallback;
import com.deliverydispatch.dispatch.cache.ClusterRelay;
import com.deliverydispatch.dispatch.cache.ClusterRelaySubscriber;
import com.deliverydispatch.dispatch.cache.LocalClusterRelay;
import com.deliverydispatch.dispatch.cache.RedisClusterRelay;
import com.deliverydispatch.dispatch.presence.InMemoryPresenceStore;
import com.deliverydispatch.dispatch.presence.PresenceBroadcaster;
import com.deliverydispatch.dispatch.presence.PresenceStore;
import com.deliverydispatch.dispatch.presence.RedisPresenceStore;
import com.deliverydispatch.dispatch.queue.InMemoryQueueStore;
import com.deliverydispatch.dispatch.queue.QueueStore;
import com.deliverydispatch.dispatch.queue.RedisQueueStore;
import com.deliverydispatch.dispatch.service.NotificationRouter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.time.Clock;
import java.util.List;

/**
 * Chooses the presence, queue and relay backends from {@code dispatch.cache.mode}.
 *
 *   redis  (default) shared state across instances, in-memory fallback when Redis is down
 *   memory single-process, no Redis traffic
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "dispatch.cache", name = "mode", havingValue = "memory")
    static class InMemoryCacheConfig {

        @Bean
        PresenceStore presenceStore(Clock clock) {
            log.info("Dispatch cache mode: in-memory");
            return new InMemoryPresenceStore(clock);
        }

        @Bean
        QueueStore queueStore() {
            return new InMemoryQueueStore();
        }

        @Bean
        ClusterRelay clusterRelay() {
            return new LocalClusterRelay();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "dispatch.cache", name = "mode", havingValue = "redis", matchIfMissing = true)
    static class RedisCacheConfig {

        @Bean
        PresenceStore presenceStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                    DispatchProperties properties, CacheFallback cacheFallback, Clock clock) {
            log.info("Dispatch cache mode: redis (instance {})", properties.getInstanceId());
            return new RedisPresenceStore(redisTemplate, objectMapper, properties.getPresence().getMarkerTtl(),
                    new InMemoryPresenceStore(clock), cacheFallback);
        }

        @Bean
        QueueStore queueStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                              CacheFallback cacheFallback) {
            return new RedisQueueStore(redisTemplate, objectMapper, new InMemoryQueueStore(), cacheFallback);
        }

        @Bean
        ClusterRelay clusterRelay(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                  CacheFallback cacheFallback, DispatchProperties properties) {
            return new RedisClusterRelay(redisTemplate, objectMapper, cacheFallback, properties.getInstanceId());
        }

        @Bean
        ClusterRelaySubscriber clusterRelaySubscriber(ObjectMapper objectMapper,
                                                      @Lazy NotificationRouter notificationRouter,
                                                      @Lazy PresenceBroadcaster presenceBroadcaster,
                                                      DispatchProperties properties) {
            return new ClusterRelaySubscriber(objectMapper, notificationRouter, presenceBroadcaster,
                    properties.getInstanceId());
        }

        @Bean
        RedisMessageListenerContainer relayListenerContainer(RedisConnectionFactory connectionFactory,
                                                             ClusterRelaySubscriber subscriber) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(connectionFactory);
            container.addMessageListener(subscriber, List.of(
                    new ChannelTopic(RedisClusterRelay.PRESENCE_CHANNEL),
                    new ChannelTopic(RedisClusterRelay.DELIVER_CHANNEL)));
            return container;
        }
    }
}
