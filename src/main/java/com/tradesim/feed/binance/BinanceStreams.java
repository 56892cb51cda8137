package com.tradesim.feed.binance;

import com.tradesim.domain.enums.EventKind;
import com.tradesim.domain.model.SubscriptionKey;
import java.util.Locale;

/** Binance stream naming. Funding and liquidation streams only exist on the futures host. */
public final class BinanceStreams {

    private BinanceStreams() {}

    public static String streamName(SubscriptionKey key, String barInterval) {
        String symbol = key.getSymbol().toLowerCase(Locale.ROOT);
        return switch (key.getKind()) {
            case TRADE -> symbol + "@trade";
            case AGGREGATED_TRADE -> symbol + "@aggTrade";
            case FUNDING_RATE -> symbol + "@markPrice";
            case LIQUIDATION -> symbol + "@forceOrder";
            case BAR_CLOSE -> symbol + "@kline_" + barInterval;
        };
    }

    public static boolean isFuturesOnly(EventKind kind) {
        return kind == EventKind.FUNDING_RATE || kind == EventKind.LIQUIDATION;
    }
}
