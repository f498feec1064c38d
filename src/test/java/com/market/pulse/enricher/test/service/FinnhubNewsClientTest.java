package com.market.pulse.enricher.test.service;

import com.market.pulse.enricher.common.Result;
import com.market.pulse.enricher.config.CustomConfig;
import com.market.pulse.enricher.config.PulseProperties;
import com.market.pulse.enricher.core.MinIntervalRateLimiter;
import com.market.pulse.enricher.dto.NewsArticle;
import com.market.pulse.enricher.dto.NewsClientStats;
import com.market.pulse.enricher.service.news.FinnhubNewsClient;
import com.market.pulse.enricher.test.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FinnhubNewsClientTest {

    @Mock
    HttpClient http;
    @Mock
    HttpResponse<String> response;

    final MutableClock clock = MutableClock.at("2024-03-15T14:02:00Z");
    FinnhubNewsClient client;

    @BeforeEach
    void setUp() {
        PulseProperties.News settings = new PulseProperties.News();
        settings.setApiKey("test-key");
        settings.setBaseUrl("https://finnhub.test/api/v1/");
        settings.setCacheTtl(Duration.ofMinutes(5));
        MinIntervalRateLimiter limiter = new MinIntervalRateLimiter(Duration.ZERO, clock);
        client = new FinnhubNewsClient(http, new CustomConfig().mapper(), settings, clock, limiter);
    }

    private void respond(int status, String body) throws Exception {
        lenient().when(response.statusCode()).thenReturn(status);
        lenient().when(response.body()).thenReturn(body);
        doReturn(response).when(http).send(any(HttpRequest.class), any());
    }

    static String articles(int n) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < n; i++) {
            if (i > 0) sb.append(',');
            sb.append("{\"headline\":\"Headline ").append(i)
                    .append("\",\"summary\":\"Summary ").append(i)
                    .append("\",\"url\":\"https://news.test/").append(i)
                    .append("\",\"datetime\":1710511200,\"source\":\"Reuters\",\"category\":\"company\"}");
        }
        return sb.append(']').toString();
    }

    @Test
    void companyNewsParsesProviderArticles() throws Exception {
        respond(200, articles(2));

        Result<List<NewsArticle>> r = client.companyNews("AAPL", 1);

        assertThat(r.isOk()).isTrue();
        assertThat(r.get()).hasSize(2);
        NewsArticle first = r.get().get(0);
        assertThat(first.headline()).isEqualTo("Headline 0");
        assertThat(first.summary()).isEqualTo("Summary 0");
        assertThat(first.source()).isEqualTo("Reuters");
        assertThat(first.publishedAt()).isEqualTo(Instant.ofEpochSecond(1710511200L));
    }

    @Test
    void requestCarriesDateRangeTokenAndUserAgent() throws Exception {
        respond(200, "[]");

        client.companyNews("AAPL", 1);

        ArgumentCaptor<HttpRequest> req = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(req.capture(), any());
        assertThat(req.getValue().uri().toString())
                .isEqualTo("https://finnhub.test/api/v1/company-news?symbol=AAPL&from=2024-03-14&to=2024-03-15");
        assertThat(req.getValue().headers().firstValue("X-Finnhub-Token")).contains("test-key");
        assertThat(req.getValue().headers().firstValue("User-Agent")).contains("MarketPulse/1.0");
    }

    @Test
    void repeatedRequestWithinBucketIsServedFromCache() throws Exception {
        respond(200, articles(3));

        List<NewsArticle> a = client.fetchCompanyNews("AAPL", 1);
        clock.advance(Duration.ofMinutes(2));
        List<NewsArticle> b = client.fetchCompanyNews("AAPL", 1);

        assertThat(b).isEqualTo(a);
        verify(http, times(1)).send(any(HttpRequest.class), any());
        NewsClientStats stats = client.getStats();
        assertThat(stats.apiCalls()).isEqualTo(1);
        assertThat(stats.cacheHits()).isEqualTo(1);
        assertThat(stats.cacheHitRatio()).isEqualTo(0.5);
        assertThat(stats.cachedKeys()).isEqualTo(1);
    }

    @Test
    void nextBucketTriggersAFreshCall() throws Exception {
        respond(200, articles(1));

        client.fetchCompanyNews("AAPL", 1);
        clock.advance(Duration.ofMinutes(5));
        client.fetchCompanyNews("AAPL", 1);

        verify(http, times(2)).send(any(HttpRequest.class), any());
        assertThat(client.getStats().cachedKeys()).isEqualTo(1);
    }

    @Test
    void nonSuccessStatusYieldsEmptyListAndIsNotCached() throws Exception {
        respond(429, "{\"error\":\"API limit reached\"}");

        Result<List<NewsArticle>> r = client.companyNews("AAPL", 1);
        List<NewsArticle> again = client.fetchCompanyNews("AAPL", 1);

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getErrorCode()).isEqualTo("ERR-NEWS-002");
        assertThat(again).isEmpty();
        verify(http, times(2)).send(any(HttpRequest.class), any());
        assertThat(client.getStats().fetchFailures()).isEqualTo(2);
        assertThat(client.getStats().cachedKeys()).isZero();
    }

    @Test
    void transportErrorsMapToTransportCode() throws Exception {
        doThrow(new IOException("connection refused")).when(http).send(any(HttpRequest.class), any());

        Result<List<NewsArticle>> r = client.companyNews("AAPL", 1);

        assertThat(r.getErrorCode()).isEqualTo("ERR-NEWS-001");
        assertThat(client.getStats().apiCalls()).isEqualTo(1);
    }

    @Test
    void timeoutMapsToTransportCode() throws Exception {
        doThrow(new HttpTimeoutException("timed out")).when(http).send(any(HttpRequest.class), any());

        assertThat(client.companyNews("AAPL", 1).getErrorCode()).isEqualTo("ERR-NEWS-001");
        assertThat(client.fetchCompanyNews("MSFT", 1)).isEmpty();
    }

    @Test
    void nonArrayBodyIsABadBody() throws Exception {
        respond(200, "{\"error\":\"Invalid API key\"}");

        assertThat(client.companyNews("AAPL", 1).getErrorCode()).isEqualTo("ERR-NEWS-003");
    }

    @Test
    void companyNewsKeepsFirstTenItemsAndSkipsBadOnes() throws Exception {
        String body = articles(12).replaceFirst("\\{\"headline\":\"Headline 2\"[^}]*}", "\"oops\"");
        respond(200, body);

        List<NewsArticle> r = client.fetchCompanyNews("AAPL", 1);

        assertThat(r).hasSize(9);
        assertThat(r).extracting(NewsArticle::headline).doesNotContain("Headline 2", "Headline 10", "Headline 11");
        assertThat(client.getStats().skippedArticles()).isEqualTo(1);
    }

    @Test
    void missingFieldsDefaultToEmpty() throws Exception {
        respond(200, "[{\"headline\":\"Only a headline\"},{\"headline\":\"Bad time\",\"datetime\":\"soon\"}]");

        List<NewsArticle> r = client.fetchCompanyNews("AAPL", 1);

        assertThat(r).hasSize(1);
        assertThat(r.get(0).summary()).isEmpty();
        assertThat(r.get(0).url()).isEmpty();
        assertThat(r.get(0).publishedAt()).isEqualTo(Instant.EPOCH);
    }

    @Test
    void marketNewsUsesCategoryEndpointAndLimit() throws Exception {
        respond(200, articles(8));

        List<NewsArticle> r = client.fetchMarketNews("general", 5);

        ArgumentCaptor<HttpRequest> req = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(req.capture(), any());
        assertThat(req.getValue().uri().toString())
                .isEqualTo("https://finnhub.test/api/v1/news?category=general&minId=0");
        assertThat(r).hasSize(5);
    }

    @Test
    void companyAndMarketNewsAreCachedSeparately() throws Exception {
        respond(200, articles(1));

        client.fetchCompanyNews("AAPL", 1);
        client.fetchMarketNews("general", 10);

        verify(http, times(2)).send(any(HttpRequest.class), any());
        assertThat(client.getStats().cachedKeys()).isEqualTo(2);
    }

    @Test
    void outOfRangeDatetimeSkipsOnlyThatItem() throws Exception {
        respond(200, "[{\"headline\":\"ok\",\"datetime\":1710511200},"
                + "{\"headline\":\"far future\",\"datetime\":1e20},"
                + "{\"headline\":\"past max instant\",\"datetime\":9223372036854775807}]");

        List<NewsArticle> r = client.fetchCompanyNews("AAPL", 1);

        assertThat(r).extracting(NewsArticle::headline).containsExactly("ok");
        assertThat(client.getStats().skippedArticles()).isEqualTo(2);
        assertThat(client.getStats().fetchFailures()).isZero();
    }

    @Test
    void unexpectedRuntimeErrorBecomesFailedResult() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenThrow(new IllegalStateException("body stream closed"));
        doReturn(response).when(http).send(any(HttpRequest.class), any());

        Result<List<NewsArticle>> r = client.companyNews("AAPL", 1);

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getErrorCode()).isEqualTo("ERR-NEWS-003");
        assertThat(client.fetchMarketNews("general", 10)).isEmpty();
        assertThat(client.getStats().fetchFailures()).isEqualTo(2);
    }

    @Test
    void returnedArticlesCannotCorruptTheCache() throws Exception {
        respond(200, articles(2));

        List<NewsArticle> first = client.fetchCompanyNews("AAPL", 1);

        assertThatThrownBy(first::clear).isInstanceOf(UnsupportedOperationException.class);
        assertThat(client.fetchCompanyNews("AAPL", 1)).hasSize(2);
    }

    @Test
    void concurrentMissesOnOneKeyCostOneCall() throws Exception {
        lenient().when(response.statusCode()).thenReturn(200);
        lenient().when(response.body()).thenReturn(articles(1));
        CountDownLatch inFlight = new CountDownLatch(1);
        doAnswer(inv -> {
            inFlight.countDown();
            Thread.sleep(200);
            return response;
        }).when(http).send(any(HttpRequest.class), any());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Result<List<NewsArticle>>> a = pool.submit(() -> client.companyNews("AAPL", 1));
            assertThat(inFlight.await(2, TimeUnit.SECONDS)).isTrue();
            Future<Result<List<NewsArticle>>> b = pool.submit(() -> client.companyNews("AAPL", 1));

            assertThat(a.get(5, TimeUnit.SECONDS).get()).hasSize(1);
            assertThat(b.get(5, TimeUnit.SECONDS).get()).hasSize(1);
        } finally {
            pool.shutdownNow();
        }

        verify(http, times(1)).send(any(HttpRequest.class), any());
        assertThat(client.getStats().cacheHits()).isEqualTo(1);
    }
}
