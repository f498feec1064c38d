package com.market.pulse.enricher.dto;

import java.time.Instant;

public record NewsArticle(
        String headline,
        String summary,
        String url,
        Instant publishedAt,
        String source
) {
    /**
     * Text the scorer reads: headline followed by summary.
     */
    public String scoringText() {
        return nvl(headline) + " " + nvl(summary);
    }

    private static String nvl(String s) {
        return s == null ? "" : s;
    }
}
