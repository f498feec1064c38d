package com.market.pulse.enricher.service.enrichment;

import com.market.pulse.enricher.bus.EventBus;
import com.market.pulse.enricher.bus.Subscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * Owns the inbound subscription: opened when the context starts, cancelled when it stops.
 */
@Slf4j
public class EnrichmentRunner implements SmartLifecycle {

    private final EventBus bus;
    private final NewsEnrichmentConsumer consumer;
    private final String inboundChannel;

    private volatile Subscription subscription;
    private volatile boolean running;

    public EnrichmentRunner(EventBus bus, NewsEnrichmentConsumer consumer, String inboundChannel) {
        this.bus = bus;
        this.consumer = consumer;
        this.inboundChannel = inboundChannel;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        log.info("Starting to listen for market events on {}", inboundChannel);
        subscription = bus.subscribe(inboundChannel, consumer::handle);
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        running = false;
        log.info("Stopping market event subscription on {}", inboundChannel);
        if (subscription != null) {
            subscription.cancel();
            subscription = null;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * True while the bus reports the inbound subscription as live.
     */
    public boolean isSubscribed() {
        Subscription s = subscription;
        return running && s != null && s.isActive();
    }

    public String getInboundChannel() {
        return inboundChannel;
    }
}
