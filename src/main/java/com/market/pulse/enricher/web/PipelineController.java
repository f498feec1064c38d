package com.market.pulse.enricher.web;

import com.market.pulse.enricher.common.Result;
import com.market.pulse.enricher.common.exception.Http;
import com.market.pulse.enricher.common.exception.NewsProviderException;
import com.market.pulse.enricher.config.PulseProperties;
import com.market.pulse.enricher.dto.NewsArticle;
import com.market.pulse.enricher.dto.SentimentResult;
import com.market.pulse.enricher.service.enrichment.EnrichmentRunner;
import com.market.pulse.enricher.service.enrichment.NewsEnrichmentConsumer;
import com.market.pulse.enricher.service.news.NewsSourceClient;
import com.market.pulse.enricher.service.sentiment.LexiconSentimentScorer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

@RestController
@RequestMapping("/api/pipeline")
public class PipelineController {

    private static final Pattern SYMBOL = Pattern.compile("[A-Z0-9.\\-]{1,10}");
    private static final int MAX_LOOKBACK_DAYS = 30;

    private final NewsEnrichmentConsumer consumer;
    private final NewsSourceClient newsClient;
    private final LexiconSentimentScorer scorer;
    private final ObjectProvider<EnrichmentRunner> runner;
    private final PulseProperties props;
    private final Clock clock;
    private final String serviceName;
    private final String version;

    public PipelineController(NewsEnrichmentConsumer consumer,
                              NewsSourceClient newsClient,
                              LexiconSentimentScorer scorer,
                              ObjectProvider<EnrichmentRunner> runner,
                              PulseProperties props,
                              Clock clock,
                              @Value("${spring.application.name:market-pulse-enricher}") String serviceName,
                              @Value("${pulse.version:1.0.0}") String version) {
        this.consumer = consumer;
        this.newsClient = newsClient;
        this.scorer = scorer;
        this.runner = runner;
        this.props = props;
        this.clock = clock;
        this.serviceName = serviceName;
        this.version = version;
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", serviceName);
        body.put("timestamp", clock.instant());
        return Http.from(Result.ok(body));
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        EnrichmentRunner r = runner.getIfAvailable();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", serviceName);
        body.put("version", version);
        body.put("status", r != null && r.isSubscribed() ? "running" : "idle");
        body.put("subscribed", r != null && r.isSubscribed());
        body.put("features", List.of(
                props.getRedis().isEnabled() ? "redis_pubsub" : "in_memory_bus",
                "news_enrichment",
                "sentiment_analysis",
                "rate_limiting",
                "news_caching"));
        return Http.from(Result.ok(body));
    }

    @GetMapping("/metrics")
    public ResponseEntity<?> metrics() {
        return Http.from(Result.ok(consumer.getStats()));
    }

    /**
     * Scores a symbol's current company news without publishing anything.
     * Bad input and provider failures are raised and mapped by the exception handler.
     */
    @GetMapping("/news/{symbol}")
    public ResponseEntity<?> newsSentiment(@PathVariable("symbol") String symbol,
                                           @RequestParam(name = "days", defaultValue = "1") int days) {
        String s = symbol.trim().toUpperCase(Locale.ROOT);
        if (!SYMBOL.matcher(s).matches()) {
            throw new IllegalArgumentException("invalid symbol: " + symbol);
        }
        if (days < 0 || days > MAX_LOOKBACK_DAYS) {
            throw new IllegalArgumentException("days must be between 0 and " + MAX_LOOKBACK_DAYS);
        }

        Result<List<NewsArticle>> news = newsClient.companyNews(s, days);
        if (news.isFailure()) {
            throw new NewsProviderException(news.getErrorCode(), news.getError());
        }
        List<NewsArticle> articles = news.get();
        SentimentResult sentiment = scorer.analyzeBatch(articles);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", s);
        body.put("sentiment", sentiment);
        body.put("headlines", articles.stream().map(NewsArticle::headline).limit(5).toList());
        return Http.from(Result.ok(body));
    }
}
