package com.market.pulse.enricher.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SentimentLabel {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    NEUTRAL("neutral");

    private final String value;

    SentimentLabel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
