package com.tradesim.feed;

import com.tradesim.domain.enums.EventKind;
import com.tradesim.domain.model.MarketEvent;
import com.tradesim.domain.model.PriceBar;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a bounded bar sequence into BAR_CLOSE events for backtests. Bars are ordered by open
 * time and run through an {@link EventSequencer}, so a source that returns duplicates or an
 * unsorted list still yields a clean, replayable stream.
 */
public final class BarReplayFeed {

    private BarReplayFeed() {}

    public static List<MarketEvent> toEvents(String symbol, List<PriceBar> bars) {
        EventSequencer sequencer = new EventSequencer();
        return bars.stream()
                .filter(bar -> bar.getOpenTime() != null && bar.getClose() != null)
                .sorted(Comparator.comparing(PriceBar::getOpenTime))
                .map(bar -> toEvent(symbol, bar))
                .filter(sequencer::accept)
                .toList();
    }

    static MarketEvent toEvent(String symbol, PriceBar bar) {
        return MarketEvent.builder()
                .symbol(symbol)
                .kind(EventKind.BAR_CLOSE)
                .timestamp(bar.getCloseTime() != null ? bar.getCloseTime() : bar.getOpenTime())
                .price(bar.getClose())
                .quantity(bar.getVolume())
                .sequence(bar.getOpenTime().toEpochMilli())
                .build();
    }
}
