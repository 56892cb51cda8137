package com.tradesim.engine;

import com.tradesim.domain.enums.EventKind;
import com.tradesim.domain.enums.ExitReason;
import com.tradesim.domain.enums.PositionSide;
import com.tradesim.domain.enums.SessionMode;
import com.tradesim.domain.enums.SessionStatus;
import com.tradesim.domain.enums.Signal;
import com.tradesim.domain.enums.TradeSide;
import com.tradesim.domain.model.ClosedTrade;
import com.tradesim.domain.model.EquityPoint;
import com.tradesim.domain.model.MarketEvent;
import com.tradesim.domain.model.Position;
import com.tradesim.domain.model.RiskParameters;
import com.tradesim.domain.model.SessionConfig;
import com.tradesim.domain.model.SessionSnapshot;
import com.tradesim.exception.InvariantViolationException;
import com.tradesim.exception.SessionStateException;
import com.tradesim.gateway.ExecutionException;
import com.tradesim.gateway.OrderAck;
import com.tradesim.pnl.FeeCalculator;
import com.tradesim.pnl.PnlCalculator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One simulated trading session: its state machine, capital, positions and trade log.
 *
 * <p>State machine: {@code CREATED -> ACTIVE <-> PAUSED -> STOPPED}. STOPPED is terminal.
 *
 * <p>Per-event processing (ACTIVE only, own symbol only):
 * <ol>
 *   <li>Entry: with fewer open positions than allowed and a non-neutral signal, open a
 *       position sized {@code min(maxPositionSize% * capital, capital) / price}, rounded down
 *       to the quantity scale. BUY opens LONG, SELL opens SHORT.</li>
 *   <li>Exits, for positions opened before this event: stop-loss, then take-profit, then an
 *       opposing signal. The first match wins.</li>
 *   <li>Equity sampling on the event-time cadence, on every BAR_CLOSE and whenever a
 *       position opened or closed.</li>
 * </ol>
 *
 * <p>After every processed event capital conservation is verified:
 * {@code currentCapital + sum(notional + entryFee of open positions) == initialCapital + sum(realizedPnl)}.
 * A violation forces the session to STOPPED.
 *
 * <p>All trade and equity times are event timestamps, so replaying the same events against
 * the same config reproduces the same trades and final capital. Mutations hold {@code lock}: the
 * worker thread feeds events while lifecycle commands arrive from request threads.
 *
 * <p>{@link #snapshot()} never waits on the lock. While the worker holds it (a LIVE order can
 * sit in a Retry-After backoff) readers get the last published snapshot.
 */
public class TradingSession {

    private static final Logger log = LoggerFactory.getLogger(TradingSession.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final String id;
    private final SessionConfig config;
    private final Instant createdAt;
    private final SessionCollaborators collaborators;
    private final FeeCalculator fees;
    private final Duration equitySampleInterval;
    private final boolean fundingMarkToMarket;

    private final List<Position> openPositions = new ArrayList<>();
    private final List<ClosedTrade> closedTrades = new ArrayList<>();
    private final List<EquityPoint> equityCurve = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    private volatile SessionStatus status = SessionStatus.CREATED;
    private volatile Instant lastProcessedAt;
    private BigDecimal currentCapital;
    private BigDecimal lastPrice;
    private BigDecimal markPrice;
    private Instant lastEventAt;
    private Instant lastSampleAt;
    private long processedEvents;
    private long discardedEvents;
    private long positionCounter;
    private Instant stoppedAt;
    private String stopReason;

    private volatile SessionSnapshot published;
    private Consumer<TradingSession> terminationListener = session -> {};

    /**
     * @param config fully resolved config: fee rates, increment, quantity scale and position
     *     limit already defaulted
     */
    public TradingSession(
            String id,
            SessionConfig config,
            SessionCollaborators collaborators,
            Duration equitySampleInterval,
            boolean fundingMarkToMarket) {
        this.id = id;
        this.config = config;
        this.collaborators = collaborators;
        this.equitySampleInterval = equitySampleInterval;
        this.fundingMarkToMarket = fundingMarkToMarket;
        this.fees = new FeeCalculator(config.getEntryFeeRate(), config.getExitFeeRate(), config.getPriceIncrement());
        this.currentCapital = config.getInitialCapital();
        this.createdAt = collaborators.getClock().instant();
        this.published = buildSnapshot();
    }

    /** Called once, right after the session reaches STOPPED. */
    public void setTerminationListener(Consumer<TradingSession> terminationListener) {
        this.terminationListener = terminationListener;
    }

    // ---- Lifecycle ----

    public void activate() {
        lock.lock();
        try {
            if (status != SessionStatus.CREATED) {
                throw new SessionStateException(id, status, "activate");
            }
            transition(SessionStatus.ACTIVE, null);
            log.info("Session {} active: {} {} on {}, capital {}",
                    id, config.getMode(), config.getStrategyRef(), config.getSymbol(), currentCapital);
        } finally {
            lock.unlock();
        }
    }

    /** ACTIVE -> PAUSED. Pausing a paused session is a no-op. */
    public void pause() {
        lock.lock();
        try {
            if (status == SessionStatus.PAUSED) {
                return;
            }
            if (status != SessionStatus.ACTIVE) {
                throw new SessionStateException(id, status, "pause");
            }
            transition(SessionStatus.PAUSED, null);
            log.info("Session {} paused", id);
        } finally {
            lock.unlock();
        }
    }

    /** PAUSED -> ACTIVE. Resuming an active session is a no-op. */
    public void resume() {
        lock.lock();
        try {
            if (status == SessionStatus.ACTIVE) {
                return;
            }
            if (status != SessionStatus.PAUSED) {
                throw new SessionStateException(id, status, "resume");
            }
            transition(SessionStatus.ACTIVE, null);
            log.info("Session {} resumed", id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes every open position at the last known price and moves to STOPPED.
     *
     * @param exitReason MANUAL for operator stops, END_OF_DATA when a backtest runs out of bars
     * @return false if the session was already stopped
     */
    public boolean stop(ExitReason exitReason, String reason) {
        lock.lock();
        try {
            if (status == SessionStatus.STOPPED) {
                return false;
            }
            if (!openPositions.isEmpty()) {
                for (Position position : List.copyOf(openPositions)) {
                    closePosition(position, lastPrice, lastEventAt, exitReason, true);
                }
                sampleEquity(lastEventAt);
            }
            stoppedAt = collaborators.getClock().instant();
            stopReason = reason;
            transition(SessionStatus.STOPPED, reason);
            log.info("Session {} stopped ({}): {} trades, capital {} -> {}",
                    id, reason, closedTrades.size(), config.getInitialCapital(), currentCapital);
        } finally {
            lock.unlock();
        }
        terminationListener.accept(this);
        return true;
    }

    /**
     * Forces STOPPED without touching positions, whose state can no longer be trusted. Used for
     * invariant violations and worker failures.
     */
    public void abort(String reason) {
        lock.lock();
        try {
            if (status == SessionStatus.STOPPED) {
                return;
            }
            stoppedAt = collaborators.getClock().instant();
            stopReason = reason;
            transition(SessionStatus.STOPPED, reason);
        } finally {
            lock.unlock();
        }
        terminationListener.accept(this);
    }

    // ---- Event processing ----

    public void onEvent(MarketEvent event) {
        String violation = null;
        lock.lock();
        try {
            if (status != SessionStatus.ACTIVE) {
                discardedEvents++;
                return;
            }
            if (!event.isWellFormed() || !config.getSymbol().equalsIgnoreCase(event.getSymbol())) {
                discardedEvents++;
                log.warn("Session {} discarded malformed or foreign event {}", id, event);
                return;
            }

            try {
                if (event.getKind() == EventKind.FUNDING_RATE) {
                    onFundingRate(event);
                } else if (event.getKind() != EventKind.LIQUIDATION) {
                    onPrice(event);
                }
                verifyCapitalConservation();
            } catch (InvariantViolationException e) {
                violation = e.getMessage();
                log.error("Session {} violated an invariant: {} details={} state={}",
                        id, e.getMessage(), e.getDetails(), buildSnapshot());
            }
        } finally {
            lock.unlock();
        }
        if (violation != null) {
            collaborators.getEventPublisherHelper().publishInvariantViolation(this, id, violation);
            abort("invariant violation: " + violation);
        }
    }

    private void onFundingRate(MarketEvent event) {
        if (!fundingMarkToMarket) {
            return;
        }
        markPrice = event.getPrice();
        if (isSampleDue(event.getTimestamp())) {
            sampleEquity(event.getTimestamp());
            publishSnapshot();
        }
    }

    private void onPrice(MarketEvent event) {
        BigDecimal price = event.getPrice();
        Instant at = event.getTimestamp();
        lastPrice = price;
        markPrice = price;
        lastEventAt = at;
        lastProcessedAt = collaborators.getClock().instant();
        processedEvents++;

        Signal signal = currentSignal();
        List<Position> heldBeforeEvent = List.copyOf(openPositions);
        boolean changed = false;

        if (openPositions.size() < config.getMaxOpenPositions() && !signal.isNeutral()) {
            changed = openPosition(signal == Signal.BUY ? PositionSide.LONG : PositionSide.SHORT, price, at);
        }

        for (Position position : heldBeforeEvent) {
            ExitReason reason = exitReasonFor(position, price, signal);
            if (reason != null) {
                changed |= closePosition(position, price, at, reason, false);
            }
        }

        if (changed || event.getKind() == EventKind.BAR_CLOSE || isSampleDue(at)) {
            sampleEquity(at);
            publishSnapshot();
        }
    }

    private Signal currentSignal() {
        try {
            Signal signal = collaborators.getSignalProvider().getSignal(config.getSymbol(), config.getTimeframe());
            return signal != null ? signal : Signal.NEUTRAL;
        } catch (RuntimeException e) {
            log.warn("Session {} signal lookup failed, treating as NEUTRAL: {}", id, e.getMessage());
            return Signal.NEUTRAL;
        }
    }

    static ExitReason exitReasonFor(Position position, BigDecimal price, Signal signal) {
        if (position.isStopLossBreached(price)) {
            return ExitReason.STOP_LOSS;
        }
        if (position.isTakeProfitBreached(price)) {
            return ExitReason.TAKE_PROFIT;
        }
        if (signal.opposes(position.getSide())) {
            return ExitReason.SIGNAL;
        }
        return null;
    }

    private boolean openPosition(PositionSide side, BigDecimal price, Instant at) {
        RiskParameters risk = config.getRisk();
        BigDecimal sizePercent = risk.getMaxPositionSizePercent() != null ? risk.getMaxPositionSizePercent() : HUNDRED;
        BigDecimal budget = currentCapital.multiply(sizePercent).divide(HUNDRED).min(currentCapital);
        if (budget.signum() <= 0) {
            log.debug("Session {} has no capital to open a position", id);
            return false;
        }
        BigDecimal quantity = budget.divide(price, config.getQuantityScale(), RoundingMode.DOWN);
        if (quantity.signum() <= 0) {
            return false;
        }

        BigDecimal entryPrice = price;
        if (config.getMode() == SessionMode.LIVE) {
            OrderAck ack = routeLiveOrder(side.entrySide(), quantity, "open " + side);
            if (ack == null) {
                return false;
            }
            entryPrice = fillPrice(ack, price);
            quantity = fillQuantity(ack, quantity);
        }

        BigDecimal notional = entryPrice.multiply(quantity);
        BigDecimal entryFee = fees.entryFee(notional);
        Position position = Position.builder()
                .id("P" + (++positionCounter))
                .symbol(config.getSymbol())
                .side(side)
                .entryPrice(entryPrice)
                .quantity(quantity)
                .entryTime(at)
                .notionalAtEntry(notional)
                .entryFee(entryFee)
                .stopLossPrice(triggerPrice(entryPrice, risk.getStopLossPercent(), side == PositionSide.LONG ? -1 : 1))
                .takeProfitPrice(triggerPrice(entryPrice, risk.getTakeProfitPercent(), side == PositionSide.LONG ? 1 : -1))
                .build();

        currentCapital = currentCapital.subtract(notional).subtract(entryFee);
        openPositions.add(position);
        log.debug("Session {} opened {} {} {} @ {}", id, side, quantity, config.getSymbol(), entryPrice);
        collaborators.getEventPublisherHelper().publishPositionOpened(this, id, position);
        return true;
    }

    /** {@code entry * (1 + sign * pct / 100)} rounded to the price increment; null without pct. */
    private BigDecimal triggerPrice(BigDecimal entryPrice, BigDecimal percent, int sign) {
        if (percent == null) {
            return null;
        }
        BigDecimal factor = BigDecimal.ONE.add(percent.multiply(BigDecimal.valueOf(sign)).divide(HUNDRED));
        return fees.roundToIncrement(entryPrice.multiply(factor));
    }

    private boolean closePosition(Position position, BigDecimal price, Instant at, ExitReason reason, boolean forced) {
        BigDecimal exitPrice = price;
        if (config.getMode() == SessionMode.LIVE) {
            OrderAck ack = routeLiveOrder(position.getSide().exitSide(), position.getQuantity(), "close " + position.getId());
            if (ack != null) {
                exitPrice = fillPrice(ack, price);
            } else if (!forced) {
                // keep the position and try again on the next event
                return false;
            }
        }

        BigDecimal gross = PnlCalculator.grossPnl(position.getSide(), position.getEntryPrice(), exitPrice, position.getQuantity());
        BigDecimal exitFee = fees.exitFee(exitPrice.multiply(position.getQuantity()));
        BigDecimal realized = gross.subtract(position.getEntryFee()).subtract(exitFee);

        ClosedTrade trade = ClosedTrade.builder()
                .positionId(position.getId())
                .symbol(position.getSymbol())
                .side(position.getSide())
                .entryPrice(position.getEntryPrice())
                .quantity(position.getQuantity())
                .entryTime(position.getEntryTime())
                .notionalAtEntry(position.getNotionalAtEntry())
                .exitPrice(exitPrice)
                .exitTime(at)
                .exitReason(reason)
                .realizedPnl(realized)
                .feesPaid(position.getEntryFee().add(exitFee))
                .pnlPercent(PnlCalculator.percentOf(realized, position.getNotionalAtEntry()))
                .build();

        currentCapital = currentCapital.add(position.allocatedCapital()).add(realized);
        openPositions.remove(position);
        closedTrades.add(trade);
        log.debug("Session {} closed {} ({}) @ {} realized {}", id, position.getId(), reason, exitPrice, realized);
        collaborators.getEventPublisherHelper().publishPositionClosed(this, id, trade);
        return true;
    }

    private OrderAck routeLiveOrder(TradeSide side, BigDecimal quantity, String purpose) {
        try {
            return collaborators.getOrderRouter().route(config.getSymbol(), side, quantity);
        } catch (ExecutionException e) {
            String message = String.format("Live order to %s failed (%s): %s", purpose, e.getType(), e.getMessage());
            log.warn("Session {}: {}", id, message);
            collaborators.getEventPublisherHelper().publishAlert(this, id, message);
            return null;
        }
    }

    private static BigDecimal fillPrice(OrderAck ack, BigDecimal fallback) {
        BigDecimal average = ack.getAverageFillPrice();
        return average != null && average.signum() > 0 ? average : fallback;
    }

    private static BigDecimal fillQuantity(OrderAck ack, BigDecimal requested) {
        BigDecimal filled = ack.getFilledQuantity();
        return filled != null && filled.signum() > 0 ? filled : requested;
    }

    // ---- Equity ----

    private boolean isSampleDue(Instant at) {
        return lastSampleAt == null || !at.isBefore(lastSampleAt.plus(equitySampleInterval));
    }

    private void sampleEquity(Instant at) {
        if (at == null) {
            return;
        }
        BigDecimal unrealized = PnlCalculator.totalUnrealizedPnl(openPositions, markPrice);
        EquityPoint point = EquityPoint.builder()
                .timestamp(at)
                .equity(currentCapital.add(PnlCalculator.markToMarket(openPositions, markPrice)))
                .cash(currentCapital)
                .unrealizedPnl(unrealized)
                .openPositions(openPositions.size())
                .build();
        equityCurve.add(point);
        lastSampleAt = at;
        collaborators.getEventPublisherHelper().publishEquitySample(this, id, point);
    }

    // ---- Invariants ----

    private void verifyCapitalConservation() {
        BigDecimal allocated = openPositions.stream()
                .map(Position::allocatedCapital)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal realized = closedTrades.stream()
                .map(ClosedTrade::getRealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal held = currentCapital.add(allocated);
        BigDecimal expected = config.getInitialCapital().add(realized);
        if (held.compareTo(expected) != 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("sessionId", id);
            details.put("currentCapital", currentCapital);
            details.put("allocated", allocated);
            details.put("realizedPnl", realized);
            details.put("initialCapital", config.getInitialCapital());
            throw new InvariantViolationException(
                    "Capital not conserved: " + held.toPlainString() + " != " + expected.toPlainString(), details);
        }
    }

    // ---- State publication ----

    private void transition(SessionStatus next, String reason) {
        SessionStatus previous = status;
        status = next;
        publishSnapshot();
        collaborators.getEventPublisherHelper().publishStatusChanged(this, id, previous, next, reason);
    }

    private void publishSnapshot() {
        published = buildSnapshot();
        collaborators.getSessionStore().save(published);
    }

    /**
     * Current state when no mutation is in flight, otherwise the snapshot published by the last
     * state change. Never blocks.
     */
    public SessionSnapshot snapshot() {
        if (lock.tryLock()) {
            try {
                published = buildSnapshot();
            } finally {
                lock.unlock();
            }
        }
        return published;
    }

    private SessionSnapshot buildSnapshot() {
        return SessionSnapshot.builder()
                .id(id)
                .config(config)
                .status(status)
                .initialCapital(config.getInitialCapital())
                .currentCapital(currentCapital)
                .openPositions(openPositions)
                .closedTrades(closedTrades)
                .equityCurve(equityCurve)
                .lastPrice(lastPrice)
                .lastEventAt(lastEventAt)
                .lastProcessedAt(lastProcessedAt)
                .processedEvents(processedEvents)
                .discardedEvents(discardedEvents)
                .createdAt(createdAt)
                .stoppedAt(stoppedAt)
                .stopReason(stopReason)
                .build();
    }

    public String getId() {
        return id;
    }

    public SessionConfig getConfig() {
        return config;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /** Time since the last processed event, or since creation if none was processed yet. */
    public Duration staleness(Instant now) {
        Instant last = lastProcessedAt != null ? lastProcessedAt : createdAt;
        return Duration.between(last, now);
    }
}
