package com.tradesim.gateway;

import com.tradesim.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Venue acknowledgement of a placed order. */
@Value
@Builder
public class OrderAck {

    String orderId;
    String clientOrderId;
    String symbol;
    TradeSide side;
    BigDecimal requestedQuantity;
    BigDecimal filledQuantity;

    /** Volume-weighted fill price, null when nothing filled yet. */
    BigDecimal averageFillPrice;

    String status;
    Instant acknowledgedAt;
}
