package com.market.pulse.enricher.service.gate;

import com.market.pulse.enricher.config.PulseProperties;
import com.market.pulse.enricher.dto.MarketEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Decides whether a market event is worth enriching.
 *
 * An event passes when its move and volume clear the thresholds and its symbol has not been
 * alerted on within the dedup window. Rejections are silent. The dedup map is purged of
 * expired symbols before every {@link #recordProcessed(String)}.
 */
@Slf4j
public class AdmissionGate {

    private final double minChangePercent;
    private final long minVolumeThreshold;
    private final Duration dedupWindow;
    private final Clock clock;

    private final Map<String, Instant> recentlyProcessed = new HashMap<>();

    public AdmissionGate(PulseProperties.Enrichment settings, Clock clock) {
        this(settings.getMinChangePercent(), settings.getMinVolumeThreshold(), settings.getDedupWindow(), clock);
    }

    public AdmissionGate(double minChangePercent, long minVolumeThreshold, Duration dedupWindow, Clock clock) {
        if (dedupWindow == null || dedupWindow.isNegative()) {
            throw new IllegalArgumentException("dedupWindow must be zero or positive");
        }
        this.minChangePercent = minChangePercent;
        this.minVolumeThreshold = minVolumeThreshold;
        this.dedupWindow = dedupWindow;
        this.clock = clock;
    }

    public synchronized boolean shouldProcess(MarketEvent event) {
        final String symbol = event.symbol();

        if (event.absChangePercent() < minChangePercent) {
            log.debug("Skipping {}: change {}% below threshold", symbol, event.changePercent());
            return false;
        }
        if (event.volume() < minVolumeThreshold) {
            log.debug("Skipping {}: volume {} below threshold", symbol, event.volume());
            return false;
        }
        Instant last = recentlyProcessed.get(symbol);
        if (last != null && elapsedSince(last).compareTo(dedupWindow) < 0) {
            log.debug("Skipping {}: recently processed at {}", symbol, last);
            return false;
        }
        return true;
    }

    public synchronized void recordProcessed(String symbol) {
        purgeExpired();
        recentlyProcessed.put(symbol, clock.instant());
    }

    /**
     * Symbols currently held in the dedup map (expired ones included until the next purge).
     */
    public synchronized int trackedSymbols() {
        return recentlyProcessed.size();
    }

    private Duration elapsedSince(Instant then) {
        return Duration.between(then, clock.instant());
    }

    private void purgeExpired() {
        int before = recentlyProcessed.size();
        recentlyProcessed.values().removeIf(ts -> elapsedSince(ts).compareTo(dedupWindow) > 0);
        int removed = before - recentlyProcessed.size();
        if (removed > 0) {
            log.debug("Cleaned up {} expired dedup entries", removed);
        }
    }
}
