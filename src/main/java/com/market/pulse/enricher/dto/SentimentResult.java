package com.market.pulse.enricher.dto;

import com.market.pulse.enricher.enums.SentimentLabel;

import java.util.List;

/**
 * Aggregate sentiment over one batch of articles. Computed per enrichment, never stored.
 */
public record SentimentResult(
        double score,
        SentimentLabel label,
        int articleCount,
        int positiveCount,
        int negativeCount,
        int neutralCount,
        List<String> topKeywords,
        double confidence
) {
    public SentimentResult {
        topKeywords = topKeywords == null ? List.of() : List.copyOf(topKeywords);
    }

    public static SentimentResult empty() {
        return new SentimentResult(0.0, SentimentLabel.NEUTRAL, 0, 0, 0, 0, List.of(), 0.0);
    }
}
