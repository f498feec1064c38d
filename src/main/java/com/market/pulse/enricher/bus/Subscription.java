package com.market.pulse.enricher.bus;

/**
 * Handle on a running channel subscription.
 */
public interface Subscription {

    String channel();

    /**
     * Stops delivery. Idempotent; a message already being handled may still complete.
     */
    void cancel();

    boolean isActive();
}
