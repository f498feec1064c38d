package com.market.pulse.enricher.config;

import com.market.pulse.enricher.bus.InMemoryEventBus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "pulse.redis.enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryBusConfig {

    @Bean(destroyMethod = "shutdown")
    public InMemoryEventBus eventBus() {
        return new InMemoryEventBus();
    }
}
