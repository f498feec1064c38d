package com.market.pulse.enricher.service.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.pulse.enricher.bus.EventBus;
import com.market.pulse.enricher.common.Result;
import com.market.pulse.enricher.common.exception.MalformedEventException;
import com.market.pulse.enricher.config.PulseProperties;
import com.market.pulse.enricher.dto.EnrichmentStats;
import com.market.pulse.enricher.dto.MarketEvent;
import com.market.pulse.enricher.dto.NewsAlert;
import com.market.pulse.enricher.dto.NewsArticle;
import com.market.pulse.enricher.dto.SentimentResult;
import com.market.pulse.enricher.enums.PipelineStage;
import com.market.pulse.enricher.service.gate.AdmissionGate;
import com.market.pulse.enricher.service.news.NewsSourceClient;
import com.market.pulse.enricher.service.sentiment.LexiconSentimentScorer;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns market events into news alerts.
 *
 * Per event: decode, admission gate, company news fetch, sentiment scoring, alert publish.
 * Each step ends the event on failure; nothing escapes {@link #handle(String)}, so the
 * subscription feeding it keeps running. Events are processed one at a time per instance.
 */
@Slf4j
public class NewsEnrichmentConsumer {

    private static final int SUMMARY_KEYWORDS = 3;

    private final EventBus bus;
    private final NewsSourceClient newsClient;
    private final LexiconSentimentScorer scorer;
    private final AdmissionGate gate;
    private final MarketEventDecoder decoder;
    private final ObjectMapper mapper;
    private final Validator validator;
    private final Clock clock;
    private final String outboundChannel;
    private final int lookbackDays;

    private final Object pipelineLock = new Object();

    // "processed" = reached the end of the pipeline (fetch + score done), whatever the publish outcome
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong publishedCount = new AtomicLong();
    private final AtomicLong malformedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private volatile Instant lastProcessed;

    public NewsEnrichmentConsumer(EventBus bus,
                                  NewsSourceClient newsClient,
                                  LexiconSentimentScorer scorer,
                                  AdmissionGate gate,
                                  ObjectMapper mapper,
                                  Validator validator,
                                  Clock clock,
                                  PulseProperties.Enrichment settings) {
        this.bus = bus;
        this.newsClient = newsClient;
        this.scorer = scorer;
        this.gate = gate;
        this.decoder = new MarketEventDecoder(mapper);
        this.mapper = mapper;
        this.validator = validator;
        this.clock = clock;
        this.outboundChannel = settings.getOutboundChannel();
        this.lookbackDays = settings.getLookbackDays();
        log.info("News consumer initialized (minChange={}%, minVolume={}, dedupWindow={})",
                settings.getMinChangePercent(), settings.getMinVolumeThreshold(), settings.getDedupWindow());
    }

    /**
     * Bus handler entry point. Never throws.
     */
    public void handle(String payload) {
        synchronized (pipelineLock) {
            process(payload);
        }
    }

    private void process(String payload) {
        final long started = System.nanoTime();
        PipelineStage stage = PipelineStage.RECEIVED;
        String symbol = "?";
        try {
            MarketEvent event;
            try {
                event = decoder.decode(payload);
            } catch (MalformedEventException e) {
                malformedCount.incrementAndGet();
                log.warn("Dropping malformed market event [{}]: {}", e.getErrorCode(), e.getMessage());
                return;
            }
            symbol = event.symbol();
            log.info("Processing market event: {} ({}%)", symbol,
                    String.format(Locale.ROOT, "%+.1f", event.changePercent()));

            stage = PipelineStage.FILTERED;
            if (!gate.shouldProcess(event)) {
                return;
            }

            stage = PipelineStage.FETCHING;
            log.info("Fetching news for {}", symbol);
            Result<List<NewsArticle>> news = newsClient.companyNews(symbol, lookbackDays);
            if (news.isFailure()) {
                log.warn("News fetch failed for {} [{}]: {}", symbol, news.getErrorCode(), news.getError());
                return;
            }
            List<NewsArticle> articles = news.get();
            if (articles == null || articles.isEmpty()) {
                log.warn("No news found for {}", symbol);
                return;
            }

            stage = PipelineStage.SCORING;
            log.info("Analyzing sentiment for {} ({} articles)", symbol, articles.size());
            SentimentResult sentiment = scorer.analyzeBatch(articles);

            stage = PipelineStage.PUBLISHING;
            NewsAlert alert = buildAlert(event, articles, sentiment);
            Result<Long> published = bus.publish(outboundChannel, mapper.writeValueAsString(alert));
            if (published.isOk()) {
                publishedCount.incrementAndGet();
                gate.recordProcessed(symbol);
                if (published.get() == 0L) {
                    log.debug("Alert for {} published with no active subscribers", symbol);
                }
                log.info("Published news alert for {}: sentiment={}", symbol,
                        String.format(Locale.ROOT, "%.3f", sentiment.score()));
            } else {
                log.error("Failed to publish news alert for {} [{}]: {}", symbol, published.getErrorCode(), published.getError());
            }

            stage = PipelineStage.DONE;
            processedCount.incrementAndGet();
            lastProcessed = clock.instant();
            log.info("Processed {} in {} ms", symbol, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        } catch (Exception e) {
            failedCount.incrementAndGet();
            log.error("Error processing market event {} at stage {}: {}", symbol, stage, e.getMessage(), e);
        }
    }

    NewsAlert buildAlert(MarketEvent event, List<NewsArticle> articles, SentimentResult sentiment) {
        List<String> headlines = new ArrayList<>(NewsAlert.MAX_HEADLINES);
        for (NewsArticle a : articles) {
            if (headlines.size() == NewsAlert.MAX_HEADLINES) break;
            headlines.add(a.headline());
        }
        NewsAlert alert = new NewsAlert(
                event.symbol(),
                event.price(),
                event.changePercent(),
                sentiment.score(),
                sentiment.articleCount(),
                summarize(articles.size(), sentiment),
                headlines,
                clock.instant());
        Set<ConstraintViolation<NewsAlert>> violations = validator.validate(alert);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException("invalid news alert for " + event.symbol(), violations);
        }
        return alert;
    }

    static String summarize(int articleCount, SentimentResult sentiment) {
        if (articleCount == 0) {
            return "No recent news available";
        }
        String summary = switch (sentiment.label()) {
            case POSITIVE -> "📈 " + articleCount + " positive news articles";
            case NEGATIVE -> "📉 " + articleCount + " negative news articles";
            case NEUTRAL -> "📊 " + articleCount + " neutral news articles";
        };
        List<String> keywords = sentiment.topKeywords();
        if (!keywords.isEmpty()) {
            summary += ". Key topics: " + String.join(", ", keywords.subList(0, Math.min(SUMMARY_KEYWORDS, keywords.size())));
        }
        return summary.length() > NewsAlert.MAX_SUMMARY_LENGTH
                ? summary.substring(0, NewsAlert.MAX_SUMMARY_LENGTH)
                : summary;
    }

    public EnrichmentStats getStats() {
        return new EnrichmentStats(
                processedCount.get(),
                publishedCount.get(),
                malformedCount.get(),
                failedCount.get(),
                lastProcessed,
                gate.trackedSymbols(),
                newsClient.getStats(),
                scorer.getStats());
    }
}
