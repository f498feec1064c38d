package com.market.pulse.enricher.service.news;

import com.market.pulse.enricher.common.Result;
import com.market.pulse.enricher.dto.NewsArticle;
import com.market.pulse.enricher.dto.NewsClientStats;

import java.util.List;

/**
 * Rate-limited, cached access to an external news provider.
 *
 * The {@code fetch*} methods never throw: a failed call and an empty answer both come
 * back as an empty list. Callers that need to tell the two apart use the
 * {@code Result}-returning variants.
 */
public interface NewsSourceClient {

    Result<List<NewsArticle>> companyNews(String symbol, int daysBack);

    Result<List<NewsArticle>> marketNews(String category, int limit);

    NewsClientStats getStats();

    default List<NewsArticle> fetchCompanyNews(String symbol, int daysBack) {
        return companyNews(symbol, daysBack).getOrElse(List.of());
    }

    default List<NewsArticle> fetchMarketNews(String category, int limit) {
        return marketNews(category, limit).getOrElse(List.of());
    }
}
