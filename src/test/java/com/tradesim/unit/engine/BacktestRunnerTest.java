package com.tradesim.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradesim.config.EngineConfig;
import com.tradesim.domain.enums.ExitReason;
import com.tradesim.domain.enums.SessionMode;
import com.tradesim.domain.enums.SessionStatus;
import com.tradesim.domain.enums.Signal;
import com.tradesim.domain.model.ClosedTrade;
import com.tradesim.domain.model.MarketEvent;
import com.tradesim.domain.model.PriceBar;
import com.tradesim.domain.model.SessionConfig;
import com.tradesim.domain.model.SessionSnapshot;
import com.tradesim.engine.BacktestRunner;
import com.tradesim.engine.LiveOrderRouter;
import com.tradesim.engine.SessionCollaborators;
import com.tradesim.engine.SessionConfigValidator;
import com.tradesim.engine.TradingSession;
import com.tradesim.event.EventPublisherHelper;
import com.tradesim.exception.FeedConnectionException;
import com.tradesim.exception.ValidationException;
import com.tradesim.feed.HistoricalBarSource;
import com.tradesim.gateway.ExecutionGateway;
import com.tradesim.store.InMemorySessionStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BacktestRunnerTest {

    private static final Instant START = Instant.parse("2024-02-01T00:00:00Z");

    private final SessionConfigValidator validator = new SessionConfigValidator(new EngineConfig());

    private final SessionConfig config = validator.validateAndResolve(SessionConfig.builder()
            .symbol("BTCUSDT")
            .mode(SessionMode.BACKTEST)
            .initialCapital(new BigDecimal("1000"))
            .backtestStart(START)
            .backtestEnd(START.plus(Duration.ofHours(1)))
            .build());

    private static List<PriceBar> bars(String... closes) {
        List<PriceBar> bars = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            Instant open = START.plus(Duration.ofMinutes(i));
            BigDecimal close = new BigDecimal(closes[i]);
            bars.add(PriceBar.builder()
                    .symbol("BTCUSDT")
                    .openTime(open)
                    .closeTime(open.plusSeconds(59))
                    .open(close)
                    .high(close)
                    .low(close)
                    .close(close)
                    .volume(BigDecimal.ONE)
                    .build());
        }
        return bars;
    }

    private TradingSession activeSession(Signal signal) {
        SessionCollaborators collaborators = new SessionCollaborators(
                (symbol, timeframe) -> signal,
                new LiveOrderRouter((ExecutionGateway) null, 1, Duration.ofMillis(1)),
                new InMemorySessionStore(),
                new EventPublisherHelper(event -> {}),
                Clock.systemUTC());
        TradingSession session = new TradingSession("bt-1", config, collaborators, Duration.ofMinutes(1), false);
        session.activate();
        return session;
    }

    @Test
    @DisplayName("Loads the configured range as BAR_CLOSE events")
    void loadsEvents() {
        List<String> requested = new ArrayList<>();
        HistoricalBarSource source = (symbol, timeframe, start, end) -> {
            requested.add(symbol + " " + timeframe + " " + start + " " + end);
            return bars("100", "101", "102");
        };

        List<MarketEvent> events = new BacktestRunner(source).loadEvents(config);

        assertThat(events).hasSize(3);
        assertThat(requested).containsExactly("BTCUSDT 1m " + START + " " + START.plus(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("Missing source, empty range and source failures are reported at load time")
    void loadFailures() {
        assertThatThrownBy(() -> new BacktestRunner((HistoricalBarSource) null).loadEvents(config))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new BacktestRunner((symbol, timeframe, start, end) -> List.of()).loadEvents(config))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("No 1m bars for BTCUSDT");
        assertThatThrownBy(() -> new BacktestRunner((symbol, timeframe, start, end) -> {
                    throw new IllegalStateException("exchange down");
                }).loadEvents(config))
                .isInstanceOf(FeedConnectionException.class)
                .hasRootCauseMessage("exchange down");
    }

    @Test
    @DisplayName("Replays every bar, then closes what is open with END_OF_DATA")
    void replaysThenStops() {
        BacktestRunner runner = new BacktestRunner((symbol, timeframe, start, end) -> bars("100", "104", "108"));
        TradingSession session = activeSession(Signal.BUY);

        runner.run(session, runner.loadEvents(config));

        SessionSnapshot snapshot = session.snapshot();
        assertThat(snapshot.getStatus()).isEqualTo(SessionStatus.STOPPED);
        assertThat(snapshot.getProcessedEvents()).isEqualTo(3);
        assertThat(snapshot.getClosedTrades()).singleElement().satisfies(trade -> {
            assertThat(trade.getExitReason()).isEqualTo(ExitReason.END_OF_DATA);
            assertThat(trade.getExitPrice()).isEqualByComparingTo("108");
        });
        assertThat(snapshot.getEquityCurve()).hasSize(4);
    }

    @Test
    @DisplayName("A session stopped mid-replay ends the replay")
    void stopsEarly() {
        AtomicInteger calls = new AtomicInteger();
        SessionCollaborators collaborators = new SessionCollaborators(
                (symbol, timeframe) -> Signal.NEUTRAL,
                new LiveOrderRouter((ExecutionGateway) null, 1, Duration.ofMillis(1)),
                new InMemorySessionStore(),
                new EventPublisherHelper(event -> {}),
                Clock.systemUTC());
        TradingSession session = new TradingSession("bt-2", config, collaborators, Duration.ofMinutes(1), false);
        session.activate();
        List<MarketEvent> events = new BacktestRunner((symbol, timeframe, start, end) -> bars("1", "2", "3", "4"))
                .loadEvents(config);
        session.setTerminationListener(s -> calls.incrementAndGet());

        session.stop(ExitReason.MANUAL, "operator");
        new BacktestRunner((HistoricalBarSource) null).run(session, events);

        assertThat(session.snapshot().getProcessedEvents()).isZero();
        assertThat(session.snapshot().getStopReason()).isEqualTo("operator");
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("A paused backtest holds its place instead of dropping bars")
    void pauseHoldsReplay() throws Exception {
        BacktestRunner runner = new BacktestRunner((symbol, timeframe, start, end) -> bars("100", "101", "102"));
        List<MarketEvent> events = runner.loadEvents(config);
        TradingSession session = activeSession(Signal.NEUTRAL);
        session.pause();

        CompletableFuture<Void> replay = CompletableFuture.runAsync(() -> runner.run(session, events));
        Thread.sleep(250);
        assertThat(replay).isNotDone();
        assertThat(session.snapshot().getProcessedEvents()).isZero();

        session.resume();
        replay.get(5, TimeUnit.SECONDS);

        assertThat(session.snapshot().getProcessedEvents()).isEqualTo(3);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.STOPPED);
        assertThat(session.snapshot().getClosedTrades()).extracting(ClosedTrade::getExitReason).isEmpty();
    }
}
