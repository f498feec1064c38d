package com.market.pulse.enricher.service.sentiment;

import com.market.pulse.enricher.common.constants.SentimentLexicon;
import com.market.pulse.enricher.dto.NewsArticle;
import com.market.pulse.enricher.dto.ScorerStats;
import com.market.pulse.enricher.dto.SentimentResult;
import com.market.pulse.enricher.enums.SentimentLabel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Keyword sentiment over financial news, backed by {@link SentimentLexicon}.
 * Stateless apart from its counters; safe to share.
 */
@Slf4j
public class LexiconSentimentScorer {

    private static final Pattern NON_LETTERS = Pattern.compile("[^a-z\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // scale raw weight-per-token before clamping
    private static final double SCALE = 10.0;

    private static final double ARTICLE_POSITIVE = 0.1;
    private static final double ARTICLE_NEGATIVE = -0.1;
    private static final double BATCH_POSITIVE = 0.2;
    private static final double BATCH_NEGATIVE = -0.2;
    private static final int TOP_KEYWORDS = 5;

    private final Map<String, Integer> wordScores;

    private final AtomicLong analysisCount = new AtomicLong();
    private final AtomicLong totalAnalysisNanos = new AtomicLong();

    public LexiconSentimentScorer() {
        this.wordScores = SentimentLexicon.WORD_SCORES;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }

    static String[] tokenize(String text) {
        if (text == null) return new String[0];
        String cleaned = NON_LETTERS.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        return cleaned.isEmpty() ? new String[0] : cleaned.split(" ");
    }

    public LexiconScore score(String text) {
        String[] tokens = tokenize(text);
        if (tokens.length == 0) return LexiconScore.zero();

        int sum = 0;
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String token : tokens) {
            Integer w = wordScores.get(token);
            if (w != null) {
                sum += w;
                counts.merge(token, 1, Integer::sum);
            }
        }
        double normalized = clamp((double) sum / tokens.length * SCALE, -1.0, 1.0);
        return new LexiconScore(normalized, counts);
    }

    public SentimentResult analyzeBatch(List<NewsArticle> articles) {
        if (articles == null || articles.isEmpty()) {
            return SentimentResult.empty();
        }
        final long started = System.nanoTime();

        double[] scores = new double[articles.size()];
        Map<String, Integer> keywords = new LinkedHashMap<>();
        int positive = 0, negative = 0, neutral = 0;
        double total = 0.0;

        for (int i = 0; i < articles.size(); i++) {
            LexiconScore s = score(articles.get(i).scoringText());
            scores[i] = s.score();
            total += s.score();
            s.matchedWordCounts().forEach((w, c) -> keywords.merge(w, c, Integer::sum));

            if (s.score() > ARTICLE_POSITIVE) positive++;
            else if (s.score() < ARTICLE_NEGATIVE) negative++;
            else neutral++;
        }

        double avg = total / articles.size();
        SentimentLabel label = avg > BATCH_POSITIVE ? SentimentLabel.POSITIVE
                : avg < BATCH_NEGATIVE ? SentimentLabel.NEGATIVE
                : SentimentLabel.NEUTRAL;

        double variance = 0.0;
        for (double s : scores) variance += (s - avg) * (s - avg);
        variance /= scores.length;
        double confidence = Math.max(0.0, 1.0 - variance);

        long elapsed = System.nanoTime() - started;
        analysisCount.incrementAndGet();
        totalAnalysisNanos.addAndGet(elapsed);
        log.info("Analyzed {} articles in {} ms. Sentiment: {}",
                articles.size(), TimeUnit.NANOSECONDS.toMillis(elapsed), String.format(Locale.ROOT, "%.3f", avg));

        return new SentimentResult(
                round3(avg),
                label,
                articles.size(),
                positive,
                negative,
                neutral,
                topKeywords(keywords),
                round3(confidence));
    }

    // Stable sort: equal counts keep first-seen order.
    private static List<String> topKeywords(Map<String, Integer> keywords) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(keywords.entrySet());
        entries.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        List<String> out = new ArrayList<>(TOP_KEYWORDS);
        for (Map.Entry<String, Integer> e : entries) {
            if (out.size() == TOP_KEYWORDS) break;
            out.add(e.getKey());
        }
        return out;
    }

    public ScorerStats getStats() {
        long count = analysisCount.get();
        long totalMs = TimeUnit.NANOSECONDS.toMillis(totalAnalysisNanos.get());
        double avgMs = count == 0 ? 0.0 : (double) totalAnalysisNanos.get() / count / 1_000_000.0;
        return new ScorerStats(count, totalMs, round3(avgMs), wordScores.size());
    }
}
