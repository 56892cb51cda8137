package com.tradesim.observability;

import com.tradesim.engine.SimulationEngine;
import com.tradesim.event.SessionEvent;
import com.tradesim.event.SessionEventType;
import com.tradesim.hub.StreamHub;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers Micrometer metrics for the hub and the simulation engine.
 * <ul>
 *   <li><b>tradesim.hub.adapters</b> (gauge): open upstream adapters</li>
 *   <li><b>tradesim.hub.subscribers</b> (gauge): live subscriptions</li>
 *   <li><b>tradesim.hub.events.dropped</b> (counter): events evicted from full channels</li>
 *   <li><b>tradesim.hub.events.delivered</b> (counter): events handed to channels</li>
 *   <li><b>tradesim.sessions.active</b> (gauge): sessions not yet stopped</li>
 *   <li><b>tradesim.sessions.staleness.max</b> (gauge, seconds): worst time since last processed event</li>
 *   <li><b>tradesim.sessions.stale</b> (gauge): sessions past {@code stale-after}</li>
 *   <li><b>tradesim.sessions.trades.closed</b> (counter, tag reason)</li>
 *   <li><b>tradesim.sessions.alerts</b> (counter)</li>
 *   <li><b>tradesim.sessions.invariant.violations</b> (counter)</li>
 * </ul>
 *
 * <p>Gauges and function counters are read lazily at scrape time; the event counters are fed
 * by {@link SessionEvent} listeners.
 */
@Service
public class EngineMetrics {

    private static final Logger log = LoggerFactory.getLogger(EngineMetrics.class);

    private final MeterRegistry meterRegistry;
    private final Counter alertCounter;
    private final Counter invariantViolationCounter;

    public EngineMetrics(MeterRegistry meterRegistry, StreamHub streamHub, SimulationEngine simulationEngine) {
        this.meterRegistry = meterRegistry;

        Gauge.builder("tradesim.hub.adapters", streamHub, StreamHub::activeAdapterCount)
                .description("Open upstream feed adapters")
                .register(meterRegistry);
        Gauge.builder("tradesim.hub.subscribers", streamHub, StreamHub::subscriberCount)
                .description("Live hub subscriptions")
                .register(meterRegistry);
        FunctionCounter.builder("tradesim.hub.events.dropped", streamHub, StreamHub::totalDroppedEvents)
                .description("Events evicted from full subscriber channels")
                .register(meterRegistry);
        FunctionCounter.builder("tradesim.hub.events.delivered", streamHub, StreamHub::totalDeliveredEvents)
                .description("Events handed to subscriber channels")
                .register(meterRegistry);

        Gauge.builder("tradesim.sessions.active", simulationEngine, SimulationEngine::activeSessionCount)
                .description("Sessions that have not stopped")
                .register(meterRegistry);
        Gauge.builder("tradesim.sessions.staleness.max", simulationEngine, EngineMetrics::maxStalenessSeconds)
                .description("Longest time since a running session processed an event")
                .baseUnit("seconds")
                .register(meterRegistry);
        Gauge.builder("tradesim.sessions.stale", simulationEngine, engine -> engine.staleSessionIds().size())
                .description("Running sessions that exceeded the staleness threshold")
                .register(meterRegistry);

        this.alertCounter = Counter.builder("tradesim.sessions.alerts")
                .description("Session alerts such as rejected live orders")
                .register(meterRegistry);
        this.invariantViolationCounter = Counter.builder("tradesim.sessions.invariant.violations")
                .description("Sessions forced to STOPPED by a broken invariant")
                .register(meterRegistry);
    }

    static double maxStalenessSeconds(SimulationEngine engine) {
        return engine.staleness().values().stream()
                .mapToDouble(duration -> duration.toMillis() / 1000.0)
                .max()
                .orElse(0.0);
    }

    @EventListener
    @Order(20)
    public void onSessionEvent(SessionEvent event) {
        if (event.getEventType() == SessionEventType.POSITION_CLOSED) {
            Counter.builder("tradesim.sessions.trades.closed")
                    .description("Closed simulated trades by exit reason")
                    .tag("reason", event.getClosedTrade().getExitReason().name())
                    .register(meterRegistry)
                    .increment();
        } else if (event.getEventType() == SessionEventType.ALERT) {
            alertCounter.increment();
        } else if (event.getEventType() == SessionEventType.INVARIANT_VIOLATION) {
            invariantViolationCounter.increment();
            log.error("Invariant violation in session {}: {}", event.getSessionId(), event.getMessage());
        }
    }
}
