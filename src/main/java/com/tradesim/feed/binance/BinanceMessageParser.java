package com.tradesim.feed.binance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradesim.domain.enums.EventKind;
import com.tradesim.domain.enums.TradeSide;
import com.tradesim.domain.model.MarketEvent;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps Binance raw stream payloads to {@link MarketEvent}s.
 *
 * <p>Handles {@code trade}, {@code aggTrade}, {@code markPriceUpdate}, {@code forceOrder} and
 * {@code kline} payloads, with or without the combined-stream {@code {"stream":..,"data":..}}
 * wrapper. Subscription acks, unclosed klines, payloads of another kind and malformed JSON all
 * yield {@link Optional#empty()}; parse failures are logged and never thrown to the socket.
 */
public class BinanceMessageParser {

    private static final Logger log = LoggerFactory.getLogger(BinanceMessageParser.class);

    private final ObjectMapper objectMapper;

    public BinanceMessageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<MarketEvent> parse(String payload, EventKind expectedKind) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unparseable Binance payload: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        JsonNode data = root.has("data") ? root.get("data") : root;
        String eventType = data.path("e").asText("");
        if (eventType.isEmpty()) {
            // {"result":null,"id":1} and similar control frames
            return Optional.empty();
        }

        try {
            Optional<MarketEvent> event = switch (eventType) {
                case "trade" -> Optional.of(trade(data, EventKind.TRADE, "t"));
                case "aggTrade" -> Optional.of(trade(data, EventKind.AGGREGATED_TRADE, "a"));
                case "markPriceUpdate" -> Optional.of(markPrice(data));
                case "forceOrder" -> Optional.of(liquidation(data));
                case "kline" -> closedKline(data);
                default -> Optional.empty();
            };
            return event.filter(e -> e.getKind() == expectedKind);
        } catch (RuntimeException e) {
            log.warn("Dropping malformed Binance {} payload: {}", eventType, e.getMessage());
            return Optional.empty();
        }
    }

    private MarketEvent trade(JsonNode data, EventKind kind, String idField) {
        return MarketEvent.builder()
                .symbol(text(data, "s"))
                .kind(kind)
                .timestamp(time(data, "T"))
                .price(decimal(data, "p"))
                .quantity(decimal(data, "q"))
                // m = buyer is the maker, so the aggressor sold
                .side(data.path("m").asBoolean() ? TradeSide.SELL : TradeSide.BUY)
                .sequence(data.has(idField) ? data.get(idField).asLong() : null)
                .build();
    }

    private MarketEvent markPrice(JsonNode data) {
        return MarketEvent.builder()
                .symbol(text(data, "s"))
                .kind(EventKind.FUNDING_RATE)
                .timestamp(time(data, "E"))
                .price(decimal(data, "p"))
                .fundingRate(decimal(data, "r"))
                .build();
    }

    private MarketEvent liquidation(JsonNode data) {
        JsonNode order = data.path("o");
        BigDecimal averagePrice = order.hasNonNull("ap") ? decimal(order, "ap") : null;
        return MarketEvent.builder()
                .symbol(text(order, "s"))
                .kind(EventKind.LIQUIDATION)
                .timestamp(time(order, "T"))
                .price(averagePrice != null && averagePrice.signum() > 0 ? averagePrice : decimal(order, "p"))
                .quantity(order.hasNonNull("z") ? decimal(order, "z") : decimal(order, "q"))
                .side(TradeSide.valueOf(text(order, "S")))
                .build();
    }

    private Optional<MarketEvent> closedKline(JsonNode data) {
        JsonNode kline = data.path("k");
        if (!kline.path("x").asBoolean(false)) {
            return Optional.empty();
        }
        return Optional.of(MarketEvent.builder()
                .symbol(text(kline, "s"))
                .kind(EventKind.BAR_CLOSE)
                .timestamp(time(kline, "T"))
                .price(decimal(kline, "c"))
                .quantity(decimal(kline, "v"))
                // bar open time identifies the bar
                .sequence(kline.get("t").asLong())
                .build());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        return value.asText();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        return new BigDecimal(text(node, field));
    }

    private static Instant time(JsonNode node, String field) {
        JsonNode value = node.has(field) ? node.get(field) : node.get("E");
        if (value == null || !value.canConvertToLong()) {
            throw new IllegalArgumentException("missing timestamp '" + field + "'");
        }
        return Instant.ofEpochMilli(value.asLong());
    }
}
