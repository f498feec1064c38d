package com.market.pulse.enricher.bus;

import com.market.pulse.enricher.common.Result;
import com.market.pulse.enricher.common.exception.EventBusException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Redis pub/sub transport. PUBLISH reports how many clients received the message;
 * subscriptions are dispatched by the listener container.
 */
@Slf4j
public class RedisEventBus implements EventBus {

    private final StringRedisTemplate redis;
    private final RedisMessageListenerContainer container;

    public RedisEventBus(StringRedisTemplate redis, RedisMessageListenerContainer container) {
        if (redis == null || container == null) {
            throw new IllegalArgumentException("redis and container must not be null");
        }
        this.redis = redis;
        this.container = container;
    }

    /**
     * Pings the server. Called once at startup; failure is fatal.
     */
    public void verifyConnection() {
        try {
            String pong = redis.execute((RedisCallback<String>) connection -> connection.ping());
            log.info("Redis connection established successfully ({})", pong);
        } catch (Exception e) {
            throw new EventBusException("Failed to connect to Redis: " + e.getMessage(), e);
        }
    }

    @Override
    public Result<Long> publish(String channel, String payload) {
        if (payload == null) payload = "{}";
        try {
            Long receivers = redis.convertAndSend(channel, payload);
            long n = receivers == null ? 0L : receivers;
            log.info("Published message to {} ({} subscribers)", channel, n);
            return Result.ok(n);
        } catch (Exception e) {
            log.error("Failed to publish message to {}: {}", channel, e.getMessage());
            return Result.fail(EventBusException.DEFAULT_ERROR_CODE, e);
        }
    }

    @Override
    public Subscription subscribe(String channel, Consumer<String> handler) {
        ChannelTopic topic = new ChannelTopic(channel);
        MessageListener listener = (message, pattern) -> {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            try {
                handler.accept(body);
            } catch (Exception e) {
                log.error("Error processing message on {}: {}", channel, e.getMessage(), e);
            }
        };
        container.addMessageListener(listener, topic);
        log.info("Subscribed to channel: {}", channel);
        return new ListenerSubscription(topic, listener);
    }

    private final class ListenerSubscription implements Subscription {
        private final ChannelTopic topic;
        private final MessageListener listener;
        private volatile boolean active = true;

        ListenerSubscription(ChannelTopic topic, MessageListener listener) {
            this.topic = topic;
            this.listener = listener;
        }

        @Override
        public String channel() {
            return topic.getTopic();
        }

        @Override
        public void cancel() {
            if (!active) return;
            active = false;
            container.removeMessageListener(listener, topic);
            log.info("Subscription to {} stopped", topic.getTopic());
        }

        @Override
        public boolean isActive() {
            return active && container.isRunning();
        }
    }
}
