package com.market.pulse.enricher.test.service;

import com.market.pulse.enricher.common.exception.MalformedEventException;
import com.market.pulse.enricher.config.CustomConfig;
import com.market.pulse.enricher.dto.MarketEvent;
import com.market.pulse.enricher.service.enrichment.MarketEventDecoder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarketEventDecoderTest {

    final MarketEventDecoder decoder = new MarketEventDecoder(new CustomConfig().mapper());

    @Test
    void decodesScannerPayload() {
        MarketEvent e = decoder.decode("""
                {"symbol":"aapl","price":185.5,"change_percent":4.2,"volume":1200000,
                 "timestamp":"2024-03-15T14:02:00","exchange":"NASDAQ"}""");

        assertThat(e.symbol()).isEqualTo("AAPL");
        assertThat(e.price()).isEqualTo(185.5);
        assertThat(e.changePercent()).isEqualTo(4.2);
        assertThat(e.volume()).isEqualTo(1_200_000L);
        assertThat(e.timestamp()).isEqualTo(Instant.parse("2024-03-15T14:02:00Z"));
    }

    @Test
    void offsetTimestampIsHonoured() {
        MarketEvent e = decoder.decode("""
                {"symbol":"MSFT","price":410,"change_percent":-3.5,"volume":90000,
                 "timestamp":"2024-03-15T10:02:00-04:00"}""");

        assertThat(e.timestamp()).isEqualTo(Instant.parse("2024-03-15T14:02:00Z"));
    }

    @Test
    void timestampIsOptional() {
        MarketEvent e = decoder.decode("{\"symbol\":\"TSLA\",\"price\":170.1,\"change_percent\":5,\"volume\":0}");

        assertThat(e.timestamp()).isNull();
        assertThat(e.volume()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "not json",
            "[1,2,3]",
            "{\"price\":1,\"change_percent\":4,\"volume\":1}",
            "{\"symbol\":\"  \",\"price\":1,\"change_percent\":4,\"volume\":1}",
            "{\"symbol\":\"WAYTOOLONGSYM\",\"price\":1,\"change_percent\":4,\"volume\":1}",
            "{\"symbol\":\"AAPL\",\"price\":0,\"change_percent\":4,\"volume\":1}",
            "{\"symbol\":\"AAPL\",\"price\":-5,\"change_percent\":4,\"volume\":1}",
            "{\"symbol\":\"AAPL\",\"price\":\"185\",\"change_percent\":4,\"volume\":1}",
            "{\"symbol\":\"AAPL\",\"price\":185,\"volume\":1}",
            "{\"symbol\":\"AAPL\",\"price\":185,\"change_percent\":4,\"volume\":-1}",
            "{\"symbol\":\"AAPL\",\"price\":185,\"change_percent\":4,\"volume\":1.5}",
            "{\"symbol\":\"AAPL\",\"price\":185,\"change_percent\":4,\"volume\":1,\"timestamp\":\"yesterday\"}"
    })
    void rejectsMalformedPayloads(String payload) {
        assertThatThrownBy(() -> decoder.decode(payload))
                .isInstanceOf(MalformedEventException.class)
                .extracting("errorCode").isEqualTo("ERR-EVT-001");
    }
}
