package com.market.pulse.enricher.test.core;

import com.market.pulse.enricher.core.TimeBucketCache;
import com.market.pulse.enricher.test.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeBucketCacheTest {

    // 14:00:00 is a 5-minute bucket boundary
    final MutableClock clock = MutableClock.at("2024-03-15T14:00:00Z");
    final TimeBucketCache<String> cache = new TimeBucketCache<>(Duration.ofMinutes(5), clock);

    @Test
    void valueIsServedUntilTheBucketEnds() {
        cache.put("AAPL:company_news", "v1");

        clock.advance(Duration.ofMinutes(4).plusSeconds(59));
        assertThat(cache.get("AAPL:company_news")).contains("v1");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("AAPL:company_news")).isEmpty();
    }

    @Test
    void expiryFollowsBucketBoundaryNotWriteTime() {
        clock.advance(Duration.ofMinutes(4));
        cache.put("market:general", "v1");

        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.get("market:general")).isEmpty();
    }

    @Test
    void putPurgesEntriesFromEarlierBuckets() {
        cache.put("AAPL:company_news", "a");
        cache.put("MSFT:company_news", "m");
        assertThat(cache.size()).isEqualTo(2);

        clock.advance(Duration.ofMinutes(5));
        cache.put("TSLA:company_news", "t");

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("TSLA:company_news")).contains("t");
    }

    @Test
    void keysAreIndependent() {
        cache.put("AAPL:company_news", "a");

        assertThat(cache.get("MSFT:company_news")).isEmpty();
        assertThat(cache.bucketKey("AAPL:company_news")).startsWith("AAPL:company_news:");
    }

    @Test
    void rejectsNonPositiveTtl() {
        assertThatThrownBy(() -> new TimeBucketCache<String>(Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
