package com.market.pulse.enricher.service.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.pulse.enricher.common.exception.MalformedEventException;
import com.market.pulse.enricher.dto.MarketEvent;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

/**
 * Turns a bus payload into a validated {@link MarketEvent}.
 *
 * Accepted timestamps: ISO date-time with an offset, or without one (read as UTC).
 * A missing timestamp is allowed.
 */
public class MarketEventDecoder {

    private static final int MAX_SYMBOL_LENGTH = 10;

    private final ObjectMapper mapper;

    public MarketEventDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public MarketEvent decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedEventException("empty payload");
        }
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEventException("payload is not a JSON object");
        }

        String symbol = requireText(root, "symbol").trim().toUpperCase(Locale.ROOT);
        if (symbol.isEmpty() || symbol.length() > MAX_SYMBOL_LENGTH) {
            throw new MalformedEventException("symbol must be 1-" + MAX_SYMBOL_LENGTH + " characters: '" + symbol + "'");
        }

        double price = requireNumber(root, "price").asDouble();
        if (!(price > 0)) {
            throw new MalformedEventException("price must be positive: " + price);
        }

        double changePercent = requireNumber(root, "change_percent").asDouble();

        JsonNode volumeNode = requireNumber(root, "volume");
        if (!volumeNode.canConvertToLong() || volumeNode.asDouble() != Math.rint(volumeNode.asDouble())) {
            throw new MalformedEventException("volume must be an integer: " + volumeNode);
        }
        long volume = volumeNode.asLong();
        if (volume < 0) {
            throw new MalformedEventException("volume must not be negative: " + volume);
        }

        return new MarketEvent(symbol, price, changePercent, volume, parseTimestamp(root.get("timestamp")));
    }

    private static String requireText(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || !n.isTextual()) {
            throw new MalformedEventException("missing or non-text field: " + field);
        }
        return n.asText();
    }

    private static JsonNode requireNumber(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || !n.isNumber()) {
            throw new MalformedEventException("missing or non-numeric field: " + field);
        }
        return n;
    }

    static Instant parseTimestamp(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (!n.isTextual()) {
            throw new MalformedEventException("timestamp must be an ISO-8601 string");
        }
        String s = n.asText().trim();
        try {
            TemporalAccessor t = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
            return t instanceof OffsetDateTime odt
                    ? odt.toInstant()
                    : ((LocalDateTime) t).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MalformedEventException("unparseable timestamp: " + s, e);
        }
    }
}
