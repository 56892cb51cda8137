package com.tradesim.engine;

import com.tradesim.event.EventPublisherHelper;
import com.tradesim.store.SessionStore;
import java.time.Clock;
import lombok.Value;

/**
 * Shared services a {@link TradingSession} calls out to. One instance per engine.
 */
@Value
public class SessionCollaborators {

    SignalProvider signalProvider;

    /** Only used by LIVE sessions. */
    LiveOrderRouter orderRouter;

    SessionStore sessionStore;
    EventPublisherHelper eventPublisherHelper;

    /** Wall clock for processing and lifecycle timestamps, never for trade times. */
    Clock clock;
}
