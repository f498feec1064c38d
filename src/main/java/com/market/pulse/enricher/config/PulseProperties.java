package com.market.pulse.enricher.config;

import com.market.pulse.enricher.bus.EventBusConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "pulse")
public class PulseProperties {

    private Redis redis = new Redis();
    private News news = new News();
    private Enrichment enrichment = new Enrichment();

    @Data
    public static class Redis {
        private boolean enabled = false; // false = in-process bus
    }

    @Data
    public static class News {
        private String apiKey;
        private String baseUrl = "https://finnhub.io/api/v1";
        private Duration cacheTtl = Duration.ofMinutes(5);
        private Duration minCallInterval = Duration.ofSeconds(1);
        private Duration requestTimeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int companyNewsLimit = 10;
    }

    @Data
    public static class Enrichment {
        private boolean enabled = true;
        private double minChangePercent = 3.0;
        private long minVolumeThreshold = 50_000L;
        private Duration dedupWindow = Duration.ofMinutes(30);
        private int lookbackDays = 1;
        private String inboundChannel = EventBusConfig.CHANNEL_MARKET_EVENTS;
        private String outboundChannel = EventBusConfig.CHANNEL_NEWS_ALERTS;
    }
}
