package com.market.pulse.enricher.bus;

public final class EventBusConfig {

    private EventBusConfig() {
    }

    public static final String CHANNEL_MARKET_EVENTS = "market_events";

    public static final String CHANNEL_NEWS_ALERTS = "news_alerts";
}
