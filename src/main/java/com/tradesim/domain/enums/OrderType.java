package com.tradesim.domain.enums;

public enum OrderType {
    MARKET,
    LIMIT
}
