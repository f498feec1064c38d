package com.market.pulse.enricher.dto;

public record ScorerStats(
        long analysesPerformed,
        long totalAnalysisMillis,
        double averageAnalysisMillis,
        int vocabularySize
) {
}
