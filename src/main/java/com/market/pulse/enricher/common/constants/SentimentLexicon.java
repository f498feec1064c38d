package com.market.pulse.enricher.common.constants;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Financial sentiment vocabulary. Downstream consumers compare scores numerically,
 * so word lists and weights must not drift.
 * Multi-word entries are kept as shipped even though single-token lookup never hits them.
 */
public interface SentimentLexicon {

    List<String> POSITIVE = Arrays.asList(
            // strong
            "bullish", "surge", "soar", "rally", "boom", "breakthrough", "record", "all-time high",
            "beat estimates", "exceed expectations", "strong earnings", "profit surge",
            // moderate
            "gain", "rise", "up", "positive", "growth", "increase", "buy", "upgrade",
            "outperform", "strong", "solid", "good", "better", "improved", "optimistic",
            "confident", "recover", "rebound", "momentum", "expansion");

    List<String> NEGATIVE = Arrays.asList(
            // strong
            "bearish", "crash", "plummet", "collapse", "bankruptcy", "scandal", "fraud",
            "miss estimates", "disappointing", "worst", "crisis", "recession",
            // moderate
            "loss", "fall", "down", "negative", "decline", "decrease", "sell", "downgrade",
            "underperform", "weak", "poor", "bad", "worse", "concern", "worry",
            "risk", "volatile", "uncertainty", "challenge", "struggle");

    // Only these carry weight 2; every other listed word weighs 1.
    List<String> STRONG_POSITIVE = Arrays.asList(
            "bullish", "surge", "soar", "rally", "boom", "breakthrough", "record");

    List<String> STRONG_NEGATIVE = Arrays.asList(
            "bearish", "crash", "plummet", "collapse", "bankruptcy", "scandal");

    Map<String, Integer> WORD_SCORES = Lexicons.build();

    final class Lexicons {
        private Lexicons() {
        }

        private static Map<String, Integer> build() {
            Map<String, Integer> scores = new LinkedHashMap<>();
            for (String w : POSITIVE) {
                scores.put(w, STRONG_POSITIVE.contains(w) ? 2 : 1);
            }
            for (String w : NEGATIVE) {
                scores.put(w, STRONG_NEGATIVE.contains(w) ? -2 : -1);
            }
            return Collections.unmodifiableMap(scores);
        }
    }
}
