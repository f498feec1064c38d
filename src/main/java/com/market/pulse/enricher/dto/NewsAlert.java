package com.market.pulse.enricher.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

/**
 * Enriched alert published on the outbound channel, serialized in snake_case.
 */
public record NewsAlert(
        @NotBlank
        String symbol,

        double price,

        double changePercent,

        @DecimalMin("-1.0") @DecimalMax("1.0")
        double newsSentiment,

        int newsCount,

        @Size(max = NewsAlert.MAX_SUMMARY_LENGTH)
        String newsSummary,

        @Size(max = NewsAlert.MAX_HEADLINES)
        List<String> topHeadlines,

        @NotNull
        Instant timestamp
) {
    public static final int MAX_SUMMARY_LENGTH = 400;
    public static final int MAX_HEADLINES = 3;

    public NewsAlert {
        topHeadlines = topHeadlines == null ? List.of() : List.copyOf(topHeadlines);
    }
}
