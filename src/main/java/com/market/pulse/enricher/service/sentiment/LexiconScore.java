package com.market.pulse.enricher.service.sentiment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Score of one text: normalized value in [-1, 1] and the lexicon words it matched,
 * in first-seen order.
 */
public record LexiconScore(double score, Map<String, Integer> matchedWordCounts) {

    public LexiconScore {
        matchedWordCounts = Collections.unmodifiableMap(new LinkedHashMap<>(matchedWordCounts));
    }

    public static LexiconScore zero() {
        return new LexiconScore(0.0, Map.of());
    }
}
