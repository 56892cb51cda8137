package com.tradesim.engine;

import com.tradesim.domain.model.MarketEvent;
import com.tradesim.hub.DeliveryChannel;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains a session's delivery channels on one session-executor thread until the session stops
 * or its primary channel is closed and empty.
 *
 * <p>Secondary channels (funding rates) are drained without waiting on every turn; the worker
 * blocks only on the primary trade channel, for at most the poll timeout, so state changes are
 * noticed promptly.
 */
class SessionWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SessionWorker.class);

    private final TradingSession session;
    private final DeliveryChannel primary;
    private final List<DeliveryChannel> secondary;
    private final Duration pollTimeout;

    SessionWorker(TradingSession session, DeliveryChannel primary, List<DeliveryChannel> secondary, Duration pollTimeout) {
        this.session = session;
        this.primary = primary;
        this.secondary = secondary;
        this.pollTimeout = pollTimeout;
    }

    @Override
    public void run() {
        log.debug("Worker for session {} started", session.getId());
        try {
            while (!session.getStatus().isTerminal()) {
                for (DeliveryChannel channel : secondary) {
                    MarketEvent event;
                    while ((event = channel.pollNow()) != null) {
                        session.onEvent(event);
                    }
                }
                MarketEvent event = primary.poll(pollTimeout);
                if (event != null) {
                    session.onEvent(event);
                } else if (primary.isExhausted()) {
                    log.info("Feed channel of session {} closed, worker exiting with session {}",
                            session.getId(), session.getStatus());
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Worker for session {} interrupted", session.getId());
        } catch (RuntimeException e) {
            log.error("Worker for session {} failed", session.getId(), e);
            session.abort("worker failure: " + e.getMessage());
        }
        log.debug("Worker for session {} finished", session.getId());
    }
}
