package com.market.pulse.enricher.config;

import com.market.pulse.enricher.bus.EventBus;
import com.market.pulse.enricher.bus.RedisEventBus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@ConditionalOnProperty(name = "pulse.redis.enabled", havingValue = "true")
public class RedisConfig {

    // connection factory and StringRedisTemplate come from spring.data.redis.* auto-configuration

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory cf) {
        ThreadPoolTaskExecutor dispatch = new ThreadPoolTaskExecutor();
        dispatch.setCorePoolSize(1);
        dispatch.setMaxPoolSize(1);
        dispatch.setThreadNamePrefix("bus-dispatch-");
        dispatch.setDaemon(true);
        dispatch.initialize();

        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(cf);
        container.setTaskExecutor(dispatch);
        return container;
    }

    @Bean
    public EventBus eventBus(StringRedisTemplate template, RedisMessageListenerContainer container) {
        RedisEventBus bus = new RedisEventBus(template, container);
        bus.verifyConnection();
        return bus;
    }
}
