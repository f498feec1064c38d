package com.market.pulse.enricher.dto;

import java.time.Instant;

/**
 * Point-in-time view of one consumer instance and its collaborators.
 */
public record EnrichmentStats(
        long processedEvents,
        long publishedAlerts,
        long malformedEvents,
        long failedEvents,
        Instant lastProcessed,
        int recentlyProcessedCount,
        NewsClientStats newsClient,
        ScorerStats scorer
) {
}
