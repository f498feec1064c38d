package com.market.pulse.enricher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.pulse.enricher.bus.EventBus;
import com.market.pulse.enricher.service.enrichment.EnrichmentHealthIndicator;
import com.market.pulse.enricher.service.enrichment.EnrichmentRunner;
import com.market.pulse.enricher.service.enrichment.NewsEnrichmentConsumer;
import com.market.pulse.enricher.service.gate.AdmissionGate;
import com.market.pulse.enricher.service.news.FinnhubNewsClient;
import com.market.pulse.enricher.service.news.NewsSourceClient;
import com.market.pulse.enricher.service.sentiment.LexiconSentimentScorer;
import jakarta.validation.Validator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PulseProperties.class)
public class EnrichmentConfig {

    @Bean
    public LexiconSentimentScorer lexiconSentimentScorer() {
        return new LexiconSentimentScorer();
    }

    @Bean
    public NewsSourceClient newsSourceClient(HttpClient newsHttpClient, ObjectMapper mapper,
                                             PulseProperties props, Clock clock) {
        return new FinnhubNewsClient(newsHttpClient, mapper, props.getNews(), clock);
    }

    @Bean
    public AdmissionGate admissionGate(PulseProperties props, Clock clock) {
        return new AdmissionGate(props.getEnrichment(), clock);
    }

    @Bean
    public NewsEnrichmentConsumer newsEnrichmentConsumer(EventBus eventBus,
                                                         NewsSourceClient newsSourceClient,
                                                         LexiconSentimentScorer scorer,
                                                         AdmissionGate gate,
                                                         ObjectMapper mapper,
                                                         Validator validator,
                                                         Clock clock,
                                                         PulseProperties props) {
        return new NewsEnrichmentConsumer(eventBus, newsSourceClient, scorer, gate, mapper, validator, clock,
                props.getEnrichment());
    }

    @Bean
    @ConditionalOnProperty(name = "pulse.enrichment.enabled", havingValue = "true", matchIfMissing = true)
    public EnrichmentRunner enrichmentRunner(EventBus eventBus, NewsEnrichmentConsumer consumer, PulseProperties props) {
        return new EnrichmentRunner(eventBus, consumer, props.getEnrichment().getInboundChannel());
    }

    @Bean
    @ConditionalOnProperty(name = "pulse.enrichment.enabled", havingValue = "true", matchIfMissing = true)
    public EnrichmentHealthIndicator enrichmentHealthIndicator(EnrichmentRunner runner, NewsEnrichmentConsumer consumer) {
        return new EnrichmentHealthIndicator(runner, consumer);
    }
}
