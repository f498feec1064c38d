package com.market.pulse.enricher.dto;

public record NewsClientStats(
        long apiCalls,
        long cacheHits,
        double cacheHitRatio,
        int cachedKeys,
        long fetchFailures,
        long skippedArticles
) {
}
