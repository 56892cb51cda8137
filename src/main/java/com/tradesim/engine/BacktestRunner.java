package com.tradesim.engine;

import com.tradesim.domain.enums.ExitReason;
import com.tradesim.domain.enums.SessionStatus;
import com.tradesim.domain.model.MarketEvent;
import com.tradesim.domain.model.PriceBar;
import com.tradesim.domain.model.SessionConfig;
import com.tradesim.exception.FeedConnectionException;
import com.tradesim.exception.ValidationException;
import com.tradesim.feed.BarReplayFeed;
import com.tradesim.feed.HistoricalBarSource;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Drives BACKTEST sessions over historical bars.
 *
 * <p>Bars are loaded up front, when the session is created, so a missing bar source or an
 * empty range fails the create call instead of an orphaned session. Replay then runs on the
 * session's worker: each bar becomes one BAR_CLOSE event, and when the bars run out the session
 * stops and anything still open is closed with END_OF_DATA.
 *
 * <p>Pausing a backtest holds the replay in place rather than dropping bars.
 */
@Service
public class BacktestRunner {

    private static final Logger log = LoggerFactory.getLogger(BacktestRunner.class);

    private static final Duration PAUSE_POLL = Duration.ofMillis(100);

    private final HistoricalBarSource barSource;

    @Autowired
    public BacktestRunner(ObjectProvider<HistoricalBarSource> barSourceProvider) {
        this(barSourceProvider.getIfAvailable());
    }

    public BacktestRunner(HistoricalBarSource barSource) {
        this.barSource = barSource;
    }

    /**
     * Fetches the bars of the session's range and converts them to replayable events.
     *
     * @throws ValidationException when no bar source is configured or the range has no bars
     * @throws FeedConnectionException when the bar source fails
     */
    public List<MarketEvent> loadEvents(SessionConfig config) {
        if (barSource == null) {
            throw new ValidationException("Backtests need a historical bar source, none is configured");
        }
        List<PriceBar> bars;
        try {
            bars = barSource.getBars(
                    config.getSymbol(), config.getTimeframe(), config.getBacktestStart(), config.getBacktestEnd());
        } catch (RuntimeException e) {
            throw new FeedConnectionException("Historical bars for " + config.getSymbol() + " unavailable", e);
        }
        List<MarketEvent> events = BarReplayFeed.toEvents(config.getSymbol(), bars == null ? List.of() : bars);
        if (events.isEmpty()) {
            throw new ValidationException("No " + config.getTimeframe() + " bars for " + config.getSymbol()
                    + " in [" + config.getBacktestStart() + ", " + config.getBacktestEnd() + ")");
        }
        log.info("Loaded {} bars for backtest of {} {}", events.size(), config.getSymbol(), config.getTimeframe());
        return events;
    }

    /** Replays {@code events} into an ACTIVE session on the calling thread, then stops it. */
    public void run(TradingSession session, List<MarketEvent> events) {
        int replayed = 0;
        try {
            for (MarketEvent event : events) {
                if (!awaitRunnable(session)) {
                    break;
                }
                session.onEvent(event);
                replayed++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Backtest {} interrupted after {} of {} bars", session.getId(), replayed, events.size());
        }
        if (session.stop(ExitReason.END_OF_DATA, "end of data")) {
            log.info("Backtest {} completed: {} bars replayed", session.getId(), replayed);
        }
    }

    /** Waits while the session is paused. Returns false once it has stopped. */
    private boolean awaitRunnable(TradingSession session) throws InterruptedException {
        while (session.getStatus() == SessionStatus.PAUSED) {
            Thread.sleep(PAUSE_POLL.toMillis());
        }
        return session.getStatus() == SessionStatus.ACTIVE;
    }
}
