package com.tradesim.event;

import com.tradesim.domain.enums.SessionStatus;
import com.tradesim.domain.model.ClosedTrade;
import com.tradesim.domain.model.EquityPoint;
import com.tradesim.domain.model.Position;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for {@link SessionEvent}s, so call sites read as
 * {@code eventPublisherHelper.publishPositionOpened(this, id, position)}.
 *
 * <p>Delivery is synchronous on the publishing thread unless a listener is {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishSessionCreated(Object source, String sessionId, SessionStatus status) {
        publish(new SessionEvent(
                source, sessionId, SessionEventType.SESSION_CREATED, status, null, null, null, null, null));
    }

    public void publishStatusChanged(
            Object source, String sessionId, SessionStatus previousStatus, SessionStatus status, String reason) {
        publish(new SessionEvent(
                source, sessionId, SessionEventType.STATUS_CHANGED, status, previousStatus, null, null, null, reason));
    }

    public void publishPositionOpened(Object source, String sessionId, Position position) {
        publish(new SessionEvent(
                source, sessionId, SessionEventType.POSITION_OPENED, null, null, position, null, null, null));
    }

    public void publishPositionClosed(Object source, String sessionId, ClosedTrade trade) {
        publish(new SessionEvent(
                source, sessionId, SessionEventType.POSITION_CLOSED, null, null, null, trade, null, null));
    }

    public void publishEquitySample(Object source, String sessionId, EquityPoint point) {
        publish(new SessionEvent(
                source, sessionId, SessionEventType.EQUITY_SAMPLE, null, null, null, null, point, null));
    }

    public void publishAlert(Object source, String sessionId, String message) {
        publish(new SessionEvent(
                source, sessionId, SessionEventType.ALERT, null, null, null, null, null, message));
    }

    public void publishInvariantViolation(Object source, String sessionId, String message) {
        publish(new SessionEvent(
                source, sessionId, SessionEventType.INVARIANT_VIOLATION, null, null, null, null, null, message));
    }

    private void publish(SessionEvent event) {
        applicationEventPublisher.publishEvent(event);
    }
}
