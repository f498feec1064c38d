package com.market.pulse.enricher.core;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * Single-token rate gate: consecutive grants are at least {@code minInterval} apart.
 *
 * Contracts:
 *  - Every caller goes through one lock, so the limiter bounds the aggregate call rate
 *    of everything sharing the instance, whatever method or symbol issued the call.
 *  - The lock is held while waiting; waiters are granted one after another.
 *  - An interrupted waiter restores the interrupt flag and gets {@code false}.
 */
@Slf4j
public final class MinIntervalRateLimiter {

    /**
     * Blocking wait, swappable so tests can drive a simulated clock.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration d) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEPER = d -> Thread.sleep(d.toMillis());

    private final Duration minInterval;
    private final Clock clock;
    private final Sleeper sleeper;

    private long lastGrantMillis = Long.MIN_VALUE; // MIN = never granted
    private long grants;

    public MinIntervalRateLimiter(Duration minInterval, Clock clock) {
        this(minInterval, clock, THREAD_SLEEPER);
    }

    public MinIntervalRateLimiter(Duration minInterval, Clock clock, Sleeper sleeper) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be zero or positive");
        }
        if (clock == null || sleeper == null) {
            throw new IllegalArgumentException("clock and sleeper must not be null");
        }
        this.minInterval = minInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public synchronized boolean acquire() {
        if (lastGrantMillis != Long.MIN_VALUE) {
            long elapsed = clock.millis() - lastGrantMillis;
            long waitMillis = minInterval.toMillis() - elapsed;
            if (waitMillis > 0) {
                log.debug("Rate limiting: sleeping for {} ms", waitMillis);
                try {
                    sleeper.sleep(Duration.ofMillis(waitMillis));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Rate limit wait interrupted");
                    return false;
                }
            }
        }
        lastGrantMillis = clock.millis();
        grants++;
        return true;
    }

    public synchronized long getGrants() {
        return grants;
    }
}
