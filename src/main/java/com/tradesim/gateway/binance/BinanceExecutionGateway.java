package com.tradesim.gateway.binance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradesim.config.BinanceConfig;
import com.tradesim.domain.enums.OrderType;
import com.tradesim.domain.enums.PositionSide;
import com.tradesim.domain.enums.TradeSide;
import com.tradesim.gateway.Balance;
import com.tradesim.gateway.ExecutionException;
import com.tradesim.gateway.ExecutionGateway;
import com.tradesim.gateway.OrderAck;
import com.tradesim.gateway.VenuePosition;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

/**
 * {@link ExecutionGateway} over the Binance spot REST API.
 *
 * <p>Signed endpoints carry {@code timestamp} and {@code recvWindow}, an HMAC-SHA256
 * {@code signature} of the query string and the {@code X-MBX-APIKEY} header. Only registered
 * when both API key and secret are configured.
 *
 * <p>Error mapping:
 * <ul>
 *   <li>HTTP 429 / 418: RATE_LIMITED, honouring {@code Retry-After}</li>
 *   <li>code -2010 mentioning insufficient balance: INSUFFICIENT_FUNDS</li>
 *   <li>any other 4xx: REJECTED_BY_VENUE with Binance's message</li>
 *   <li>{@link IOException}: DISCONNECTED</li>
 *   <li>everything else: UNKNOWN</li>
 * </ul>
 */
@Component
@ConditionalOnExpression(
        "!'${tradesim.binance.api-key:}'.isBlank() && !'${tradesim.binance.api-secret:}'.isBlank()")
public class BinanceExecutionGateway implements ExecutionGateway {

    private static final Logger log = LoggerFactory.getLogger(BinanceExecutionGateway.class);

    private static final String API_KEY_HEADER = "X-MBX-APIKEY";
    private static final int INSUFFICIENT_BALANCE_CODE = -2010;
    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);
    private static final int PRICE_SCALE = 8;

    private final BinanceConfig binanceConfig;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final BinanceSigner signer;
    private final Clock clock;

    @Autowired
    public BinanceExecutionGateway(BinanceConfig binanceConfig, OkHttpClient binanceHttpClient, ObjectMapper objectMapper) {
        this(binanceConfig, binanceHttpClient, objectMapper, Clock.systemUTC());
    }

    public BinanceExecutionGateway(
            BinanceConfig binanceConfig, OkHttpClient httpClient, ObjectMapper objectMapper, Clock clock) {
        this.binanceConfig = binanceConfig;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.signer = new BinanceSigner(binanceConfig.getApiSecret());
        this.clock = clock;
    }

    @Override
    public String venue() {
        return "binance";
    }

    @Override
    public OrderAck placeOrder(String symbol, TradeSide side, BigDecimal quantity, OrderType type) {
        if (type != OrderType.MARKET) {
            throw ExecutionException.rejected(type + " orders need a limit price; only MARKET is supported");
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol.toUpperCase(Locale.ROOT));
        params.put("side", side.name());
        params.put("type", type.name());
        params.put("quantity", quantity.stripTrailingZeros().toPlainString());
        params.put("newOrderRespType", "FULL");

        JsonNode body = signedCall("POST", "/api/v3/order", params);
        BigDecimal executed = decimal(body, "executedQty");
        BigDecimal quoteSpent = decimal(body, "cummulativeQuoteQty");
        BigDecimal average = executed.signum() > 0
                ? quoteSpent.divide(executed, PRICE_SCALE, RoundingMode.HALF_UP).stripTrailingZeros()
                : null;

        OrderAck ack = OrderAck.builder()
                .orderId(body.path("orderId").asText())
                .clientOrderId(body.path("clientOrderId").asText(null))
                .symbol(body.path("symbol").asText(symbol))
                .side(side)
                .requestedQuantity(quantity)
                .filledQuantity(executed)
                .averageFillPrice(average)
                .status(body.path("status").asText())
                .acknowledgedAt(body.has("transactTime")
                        ? Instant.ofEpochMilli(body.get("transactTime").asLong())
                        : clock.instant())
                .build();
        log.info("Binance order {} {} {} {}: {}", ack.getOrderId(), side, quantity, symbol, ack.getStatus());
        return ack;
    }

    @Override
    public void cancelOrder(String symbol, String orderId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol.toUpperCase(Locale.ROOT));
        params.put("orderId", orderId);
        signedCall("DELETE", "/api/v3/order", params);
        log.info("Binance order {} on {} cancelled", orderId, symbol);
    }

    @Override
    public List<Balance> getBalances() {
        JsonNode account = signedCall("GET", "/api/v3/account", new LinkedHashMap<>());
        List<Balance> balances = new ArrayList<>();
        for (JsonNode node : account.path("balances")) {
            Balance balance = Balance.builder()
                    .asset(node.path("asset").asText())
                    .free(decimal(node, "free"))
                    .locked(decimal(node, "locked"))
                    .build();
            if (balance.total().signum() > 0) {
                balances.add(balance);
            }
        }
        return balances;
    }

    /** Spot has no positions; every non-zero, non-quote balance is reported as a long. */
    @Override
    public List<VenuePosition> getPositions() {
        String quote = binanceConfig.getQuoteAsset();
        return getBalances().stream()
                .filter(balance -> !balance.getAsset().equalsIgnoreCase(quote))
                .map(balance -> VenuePosition.builder()
                        .symbol(balance.getAsset() + quote)
                        .side(PositionSide.LONG)
                        .quantity(balance.total())
                        .build())
                .toList();
    }

    // ---- Transport ----

    private JsonNode signedCall(String method, String path, Map<String, String> params) {
        params.put("recvWindow", String.valueOf(binanceConfig.getRecvWindowMs()));
        params.put("timestamp", String.valueOf(clock.millis()));
        String query = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        String url = binanceConfig.getRestUrl() + path + "?" + query + "&signature=" + signer.sign(query);

        Request.Builder request = new Request.Builder().url(url).header(API_KEY_HEADER, binanceConfig.getApiKey());
        switch (method) {
            case "POST" -> request.post(RequestBody.create(new byte[0]));
            case "DELETE" -> request.delete();
            default -> request.get();
        }

        try (Response response = httpClient.newCall(request.build()).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw mapError(response.code(), text, response.header("Retry-After"));
            }
            return objectMapper.readTree(text);
        } catch (ExecutionException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw ExecutionException.unknown("Unreadable Binance response to " + method + " " + path, e);
        } catch (IOException e) {
            throw ExecutionException.disconnected("Binance " + method + " " + path + " failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw ExecutionException.unknown("Binance " + method + " " + path + " failed: " + e.getMessage(), e);
        }
    }

    /** Maps a non-2xx Binance response to the execution error taxonomy. */
    ExecutionException mapError(int httpStatus, String body, String retryAfterHeader) {
        if (httpStatus == 429 || httpStatus == 418) {
            return ExecutionException.rateLimited(parseRetryAfter(retryAfterHeader));
        }

        int code = 0;
        String message = body;
        try {
            JsonNode node = objectMapper.readTree(body);
            code = node.path("code").asInt(0);
            message = node.path("msg").asText(body);
        } catch (IOException | RuntimeException e) {
            log.debug("Binance error body is not JSON: {}", body);
        }

        if (httpStatus >= 400 && httpStatus < 500) {
            if (code == INSUFFICIENT_BALANCE_CODE && message.toLowerCase(Locale.ROOT).contains("insufficient")) {
                return ExecutionException.insufficientFunds(message);
            }
            return ExecutionException.rejected(message);
        }
        return ExecutionException.unknown("HTTP " + httpStatus + ": " + message, null);
    }

    private static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return DEFAULT_RETRY_AFTER;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            return DEFAULT_RETRY_AFTER;
        }
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? BigDecimal.ZERO : new BigDecimal(value.asText());
    }
}
