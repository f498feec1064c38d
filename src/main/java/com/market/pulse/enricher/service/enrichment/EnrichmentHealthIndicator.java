package com.market.pulse.enricher.service.enrichment;

import com.market.pulse.enricher.dto.EnrichmentStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

public class EnrichmentHealthIndicator implements HealthIndicator {

    private final EnrichmentRunner runner;
    private final NewsEnrichmentConsumer consumer;

    public EnrichmentHealthIndicator(EnrichmentRunner runner, NewsEnrichmentConsumer consumer) {
        this.runner = runner;
        this.consumer = consumer;
    }

    @Override
    public Health health() {
        try {
            EnrichmentStats stats = consumer.getStats();
            if (runner.isSubscribed()) {
                return Health.up()
                        .withDetail("channel", runner.getInboundChannel())
                        .withDetail("processed_events", stats.processedEvents())
                        .withDetail("published_alerts", stats.publishedAlerts())
                        .build();
            } else {
                return Health.down()
                        .withDetail("channel", runner.getInboundChannel())
                        .withDetail("status", "Market event subscription not active")
                        .build();
            }
        } catch (Exception e) {
            return Health.down()
                    .withDetail("status", "Enrichment state not accessible")
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
