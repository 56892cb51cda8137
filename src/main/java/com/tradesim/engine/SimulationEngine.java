package com.tradesim.engine;

import com.tradesim.config.EngineConfig;
import com.tradesim.domain.enums.EventKind;
import com.tradesim.domain.enums.ExitReason;
import com.tradesim.domain.enums.SessionMode;
import com.tradesim.domain.enums.SessionStatus;
import com.tradesim.domain.model.MarketEvent;
import com.tradesim.domain.model.SessionConfig;
import com.tradesim.domain.model.SessionSnapshot;
import com.tradesim.event.EventPublisherHelper;
import com.tradesim.exception.CapacityExceededException;
import com.tradesim.exception.ResourceNotFoundException;
import com.tradesim.exception.SessionStateException;
import com.tradesim.exception.ValidationException;
import com.tradesim.hub.DeliveryChannel;
import com.tradesim.hub.StreamHub;
import com.tradesim.hub.Subscription;
import com.tradesim.store.SessionStore;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Owns the running simulation sessions and their lifecycle commands.
 *
 * <p>Each running session has:
 * <ul>
 *   <li>one hub subscription at kind TRADE, plus FUNDING_RATE when funding mark-to-market is on
 *       (BACKTEST sessions replay bars instead)</li>
 *   <li>one worker task on the session executor that feeds the session its events</li>
 * </ul>
 *
 * <p>Stopped sessions leave the registry and remain readable through the {@link SessionStore}.
 * Whatever stops a session (operator, end of backtest data, invariant violation) releases its
 * subscriptions through the session's termination listener.
 */
@Service
public class SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    private final StreamHub streamHub;
    private final SessionStore sessionStore;
    private final SessionConfigValidator validator;
    private final BacktestRunner backtestRunner;
    private final TaskExecutor sessionExecutor;
    private final EngineConfig engineConfig;
    private final SessionCollaborators collaborators;

    private final Map<String, RunningSession> running = new ConcurrentHashMap<>();

    @Autowired
    public SimulationEngine(
            StreamHub streamHub,
            SessionStore sessionStore,
            SessionConfigValidator validator,
            BacktestRunner backtestRunner,
            LiveOrderRouter liveOrderRouter,
            SignalProvider signalProvider,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("sessionExecutor") TaskExecutor sessionExecutor,
            EngineConfig engineConfig) {
        this(streamHub, sessionStore, validator, backtestRunner, sessionExecutor, engineConfig,
                new SessionCollaborators(
                        signalProvider, liveOrderRouter, sessionStore, eventPublisherHelper, Clock.systemUTC()));
    }

    public SimulationEngine(
            StreamHub streamHub,
            SessionStore sessionStore,
            SessionConfigValidator validator,
            BacktestRunner backtestRunner,
            TaskExecutor sessionExecutor,
            EngineConfig engineConfig,
            SessionCollaborators collaborators) {
        this.streamHub = streamHub;
        this.sessionStore = sessionStore;
        this.validator = validator;
        this.backtestRunner = backtestRunner;
        this.sessionExecutor = sessionExecutor;
        this.engineConfig = engineConfig;
        this.collaborators = collaborators;
    }

    // ---- Commands ----

    /**
     * Validates the config, creates the session and starts it.
     *
     * @throws ValidationException for an invalid config, a LIVE session without an execution
     *     gateway, or a backtest range without bars
     * @throws CapacityExceededException when no worker thread is free
     * @throws RuntimeException any other start-up failure, after the session has been removed
     *     again and its subscriptions released
     */
    public SessionSnapshot create(SessionConfig requested) {
        SessionConfig config = validator.validateAndResolve(requested);
        if (config.getMode() == SessionMode.LIVE && !collaborators.getOrderRouter().isAvailable()) {
            throw new ValidationException("LIVE sessions need an execution gateway; configure exchange credentials");
        }
        List<MarketEvent> backtestEvents =
                config.getMode() == SessionMode.BACKTEST ? backtestRunner.loadEvents(config) : List.of();

        String id = UUID.randomUUID().toString();
        TradingSession session = new TradingSession(
                id, config, collaborators, engineConfig.getEquitySampleInterval(), engineConfig.isFundingMarkToMarket());
        RunningSession entry = new RunningSession(session);
        session.setTerminationListener(this::onSessionStopped);
        running.put(id, entry);
        sessionStore.save(session.snapshot());
        collaborators.getEventPublisherHelper().publishSessionCreated(this, id, session.getStatus());

        try {
            if (config.getMode() == SessionMode.BACKTEST) {
                session.activate();
                sessionExecutor.execute(() -> backtestRunner.run(session, backtestEvents));
            } else {
                startStreaming(entry);
            }
        } catch (RuntimeException e) {
            releaseSubscriptions(entry);
            running.remove(id);
            sessionStore.delete(id);
            if (e instanceof RejectedExecutionException) {
                log.warn("Session {} rejected: worker pool exhausted", id);
                throw new CapacityExceededException(activeSessionCount());
            }
            log.error("Session {} failed to start, rolled back: {}", id, e.getMessage());
            throw e;
        }

        log.info("Session {} created: {} {} {} capital {}",
                id, config.getMode(), config.getSymbol(), config.getTimeframe(), config.getInitialCapital());
        return session.snapshot();
    }

    private void startStreaming(RunningSession entry) {
        TradingSession session = entry.session;
        String symbol = session.getConfig().getSymbol();
        Subscription trades = streamHub.subscribe(symbol, EventKind.TRADE);
        entry.subscriptions.add(trades);
        List<DeliveryChannel> secondary = new ArrayList<>();
        if (engineConfig.isFundingMarkToMarket()) {
            Subscription funding = streamHub.subscribe(symbol, EventKind.FUNDING_RATE);
            entry.subscriptions.add(funding);
            secondary.add(funding.getChannel());
        }
        session.activate();
        sessionExecutor.execute(new SessionWorker(
                session, trades.getChannel(), secondary, engineConfig.getWorkerPollTimeout()));
    }

    public SessionSnapshot pause(String id) {
        TradingSession session = requireRunning(id, "pause");
        session.pause();
        return session.snapshot();
    }

    public SessionSnapshot resume(String id) {
        TradingSession session = requireRunning(id, "resume");
        session.resume();
        return session.snapshot();
    }

    /** Stops a session, closing its positions with MANUAL. Stopping a stopped session is a no-op. */
    public SessionSnapshot stop(String id) {
        RunningSession entry = running.get(id);
        if (entry == null) {
            return sessionStore.findById(id).orElseThrow(() -> new ResourceNotFoundException("Session", id));
        }
        entry.session.stop(ExitReason.MANUAL, "stopped by operator");
        return entry.session.snapshot();
    }

    /**
     * Removes a session's record.
     *
     * @param onlyIfStopped when true a session that has not stopped is rejected; when false it is
     *     stopped first
     * @throws SessionStateException if {@code onlyIfStopped} and the session is still running
     */
    public void delete(String id, boolean onlyIfStopped) {
        SessionSnapshot snapshot = get(id);
        if (snapshot.getStatus() != SessionStatus.STOPPED) {
            if (onlyIfStopped) {
                throw new SessionStateException(id, snapshot.getStatus(), "delete");
            }
            stop(id);
        }
        sessionStore.delete(id);
        log.info("Session {} deleted", id);
    }

    public SessionSnapshot get(String id) {
        RunningSession entry = running.get(id);
        if (entry != null) {
            return entry.session.snapshot();
        }
        return sessionStore.findById(id).orElseThrow(() -> new ResourceNotFoundException("Session", id));
    }

    public List<SessionSnapshot> list() {
        return sessionStore.findAll().stream()
                .map(snapshot -> Optional.ofNullable(running.get(snapshot.getId()))
                        .map(entry -> entry.session.snapshot())
                        .orElse(snapshot))
                .toList();
    }

    // ---- Observability ----

    public int activeSessionCount() {
        return running.size();
    }

    public Collection<TradingSession> runningSessions() {
        return running.values().stream().map(entry -> entry.session).toList();
    }

    /** Staleness of every running, unpaused streaming session. */
    public Map<String, Duration> staleness() {
        Instant now = collaborators.getClock().instant();
        Map<String, Duration> result = new ConcurrentHashMap<>();
        running.forEach((id, entry) -> {
            if (entry.session.getStatus() == SessionStatus.ACTIVE
                    && entry.session.getConfig().getMode() != SessionMode.BACKTEST) {
                result.put(id, entry.session.staleness(now));
            }
        });
        return result;
    }

    /** Running sessions that have processed nothing for longer than {@code tradesim.engine.stale-after}. */
    public List<String> staleSessionIds() {
        return staleness().entrySet().stream()
                .filter(e -> e.getValue().compareTo(engineConfig.getStaleAfter()) > 0)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Simulation engine shutting down with {} running sessions", running.size());
        streamHub.shutdown();
    }

    // ---- Internals ----

    private TradingSession requireRunning(String id, String command) {
        RunningSession entry = running.get(id);
        if (entry != null) {
            return entry.session;
        }
        SessionSnapshot stored = sessionStore.findById(id).orElseThrow(() -> new ResourceNotFoundException("Session", id));
        throw new SessionStateException(id, stored.getStatus(), command);
    }

    private void onSessionStopped(TradingSession session) {
        RunningSession entry = running.remove(session.getId());
        if (entry != null) {
            releaseSubscriptions(entry);
        }
    }

    private void releaseSubscriptions(RunningSession entry) {
        entry.subscriptions.forEach(subscription -> streamHub.unsubscribe(subscription.getId()));
    }

    private static final class RunningSession {

        private final TradingSession session;
        private final List<Subscription> subscriptions = new ArrayList<>();

        private RunningSession(TradingSession session) {
            this.session = session;
        }
    }
}
