package com.market.pulse.enricher.service.news;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.pulse.enricher.common.Result;
import com.market.pulse.enricher.common.exception.NewsProviderException;
import com.market.pulse.enricher.config.PulseProperties;
import com.market.pulse.enricher.core.MinIntervalRateLimiter;
import com.market.pulse.enricher.core.TimeBucketCache;
import com.market.pulse.enricher.dto.NewsArticle;
import com.market.pulse.enricher.dto.NewsClientStats;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Finnhub REST client.
 *
 * Every outbound call passes one shared {@link MinIntervalRateLimiter}; results are kept in a
 * {@link TimeBucketCache} keyed by (symbol or "market", category), so a hit costs neither a
 * call nor a rate-limit wait. Failures are logged and returned as a failed {@link Result}.
 */
@Slf4j
public class FinnhubNewsClient implements NewsSourceClient {

    static final String CATEGORY_COMPANY = "company_news";
    static final String MARKET_KEY = "market";
    private static final String USER_AGENT = "MarketPulse/1.0";
    private static final String TOKEN_HEADER = "X-Finnhub-Token";

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final MinIntervalRateLimiter rateLimiter;
    private final TimeBucketCache<List<NewsArticle>> cache;

    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;
    private final int companyNewsLimit;

    private final Object fetchLock = new Object();

    private final AtomicLong apiCalls = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong fetchFailures = new AtomicLong();
    private final AtomicLong skippedArticles = new AtomicLong();

    public FinnhubNewsClient(HttpClient httpClient, ObjectMapper mapper, PulseProperties.News settings, Clock clock) {
        this(httpClient, mapper, settings, clock, new MinIntervalRateLimiter(settings.getMinCallInterval(), clock));
    }

    public FinnhubNewsClient(HttpClient httpClient, ObjectMapper mapper, PulseProperties.News settings, Clock clock,
                             MinIntervalRateLimiter rateLimiter) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.clock = clock;
        this.rateLimiter = rateLimiter;
        this.cache = new TimeBucketCache<>(settings.getCacheTtl(), clock);
        this.baseUrl = stripTrailingSlash(settings.getBaseUrl());
        this.apiKey = settings.getApiKey();
        this.requestTimeout = settings.getRequestTimeout();
        this.companyNewsLimit = settings.getCompanyNewsLimit();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No Finnhub API key configured; provider calls will be unauthenticated");
        }
    }

    private static String stripTrailingSlash(String s) {
        if (s == null) return "";
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    // ---------- Public API ----------

    @Override
    public Result<List<NewsArticle>> companyNews(String symbol, int daysBack) {
        final String key = symbol + ":" + CATEGORY_COMPANY;
        LocalDate to = LocalDate.now(clock);
        LocalDate from = to.minusDays(Math.max(0, daysBack));
        URI uri = URI.create(baseUrl + "/company-news?symbol=" + enc(symbol) + "&from=" + from + "&to=" + to);

        Result<List<NewsArticle>> r = cachedFetch(key, uri, companyNewsLimit);
        if (r.isOk()) {
            log.info("Fetched {} news articles for {}", r.get().size(), symbol);
        } else {
            log.error("Finnhub company news request failed for {}: [{}] {}", symbol, r.getErrorCode(), r.getError());
        }
        return r;
    }

    @Override
    public Result<List<NewsArticle>> marketNews(String category, int limit) {
        final String key = MARKET_KEY + ":" + category;
        URI uri = URI.create(baseUrl + "/news?category=" + enc(category) + "&minId=0");

        Result<List<NewsArticle>> r = cachedFetch(key, uri, Math.max(0, limit));
        if (r.isOk()) {
            log.info("Fetched {} market news articles", r.get().size());
        } else {
            log.error("Finnhub market news request failed for {}: [{}] {}", category, r.getErrorCode(), r.getError());
        }
        return r;
    }

    @Override
    public NewsClientStats getStats() {
        long calls = apiCalls.get();
        long hits = cacheHits.get();
        double ratio = (calls + hits) == 0 ? 0.0 : Math.round((double) hits / (calls + hits) * 1000.0) / 1000.0;
        return new NewsClientStats(calls, hits, ratio, cache.size(), fetchFailures.get(), skippedArticles.get());
    }

    // ---------- Internals ----------

    // check, fetch and store under one lock: concurrent misses on a key cost a single call
    private Result<List<NewsArticle>> cachedFetch(String cacheKey, URI uri, int limit) {
        synchronized (fetchLock) {
            Optional<List<NewsArticle>> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                log.debug("Cache hit for {}", cacheKey);
                cacheHits.incrementAndGet();
                return Result.ok(cached.get());
            }
            return fetch(uri, cacheKey, limit);
        }
    }

    private Result<List<NewsArticle>> fetch(URI uri, String cacheKey, int limit) {
        try {
            String body = call(uri);
            List<NewsArticle> articles = parseArticles(body, limit);
            cache.put(cacheKey, articles);
            return Result.ok(articles);
        } catch (NewsProviderException e) {
            fetchFailures.incrementAndGet();
            return Result.fail(e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            fetchFailures.incrementAndGet();
            log.error("Unexpected error handling response from {}", uri.getPath(), e);
            return Result.fail(NewsProviderException.BAD_BODY, e);
        }
    }

    private String call(URI uri) {
        if (!rateLimiter.acquire()) {
            throw new NewsProviderException(NewsProviderException.TRANSPORT, "interrupted while waiting for rate limit");
        }

        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(uri)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .GET();
        if (apiKey != null && !apiKey.isBlank()) {
            b.header(TOKEN_HEADER, apiKey);
        }

        HttpResponse<String> response;
        apiCalls.incrementAndGet();
        try {
            response = httpClient.send(b.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new NewsProviderException(NewsProviderException.TRANSPORT,
                    "request timed out after " + requestTimeout.toMillis() + " ms", e);
        } catch (IOException e) {
            throw new NewsProviderException("request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NewsProviderException("request interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new NewsProviderException(NewsProviderException.BAD_STATUS, "HTTP " + status + " for " + uri.getPath());
        }
        return response.body();
    }

    List<NewsArticle> parseArticles(String body, int limit) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new NewsProviderException(NewsProviderException.BAD_BODY, "unparseable response body", e);
        }
        if (root == null || !root.isArray()) {
            throw new NewsProviderException(NewsProviderException.BAD_BODY, "expected a JSON array of articles");
        }

        List<NewsArticle> out = new ArrayList<>();
        int n = Math.min(root.size(), limit);
        for (int i = 0; i < n; i++) {
            try {
                out.add(toArticle(root.get(i)));
            } catch (IllegalArgumentException | DateTimeException e) {
                skippedArticles.incrementAndGet();
                log.warn("Error processing news item #{}: {}", i, e.getMessage());
            }
        }
        return List.copyOf(out);
    }

    private static NewsArticle toArticle(JsonNode item) {
        if (item == null || !item.isObject()) {
            throw new IllegalArgumentException("article is not a JSON object");
        }
        JsonNode ts = item.get("datetime");
        Instant publishedAt;
        if (ts == null || ts.isNull()) {
            publishedAt = Instant.EPOCH;
        } else if (ts.isNumber()) {
            if (!ts.canConvertToLong()) {
                throw new IllegalArgumentException("datetime out of range: " + ts);
            }
            publishedAt = Instant.ofEpochSecond(ts.asLong());
        } else {
            throw new IllegalArgumentException("datetime is not numeric: " + ts);
        }
        return new NewsArticle(
                text(item, "headline"),
                text(item, "summary"),
                text(item, "url"),
                publishedAt,
                text(item, "source"));
    }

    private static String text(JsonNode item, String field) {
        JsonNode n = item.get(field);
        if (n == null || n.isNull()) return "";
        if (n.isContainerNode()) {
            throw new IllegalArgumentException(field + " is not a scalar");
        }
        return n.asText();
    }
}
