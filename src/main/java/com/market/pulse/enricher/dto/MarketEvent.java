package com.market.pulse.enricher.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * Price movement reported by the upstream scanner. Immutable once decoded.
 */
public record MarketEvent(
        @NotBlank @Size(max = 10)
        String symbol,

        @Positive
        double price,

        double changePercent,

        @PositiveOrZero
        long volume,

        Instant timestamp
) {
    public double absChangePercent() {
        return Math.abs(changePercent);
    }
}
