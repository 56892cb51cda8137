package com.tradesim.event;

import com.tradesim.domain.enums.SessionStatus;
import com.tradesim.domain.model.ClosedTrade;
import com.tradesim.domain.model.EquityPoint;
import com.tradesim.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every observable change of a simulation session: creation, status
 * transitions, opened and closed positions, equity samples and alerts.
 *
 * <p>Only the payload matching {@link #getEventType()} is set; the others are null. Events of
 * one session are published from that session's worker thread in the order they happened.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>EngineMetrics counts closed trades by exit reason, alerts and invariant violations</li>
 * </ul>
 */
public class SessionEvent extends ApplicationEvent {

    private final String sessionId;
    private final SessionEventType eventType;
    private final SessionStatus status;
    private final SessionStatus previousStatus;
    private final Position position;
    private final ClosedTrade closedTrade;
    private final EquityPoint equityPoint;
    private final String message;

    SessionEvent(
            Object source,
            String sessionId,
            SessionEventType eventType,
            SessionStatus status,
            SessionStatus previousStatus,
            Position position,
            ClosedTrade closedTrade,
            EquityPoint equityPoint,
            String message) {
        super(source);
        this.sessionId = sessionId;
        this.eventType = eventType;
        this.status = status;
        this.previousStatus = previousStatus;
        this.position = position;
        this.closedTrade = closedTrade;
        this.equityPoint = equityPoint;
        this.message = message;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionEventType getEventType() {
        return eventType;
    }

    /** Session status after the change. Set on SESSION_CREATED and STATUS_CHANGED. */
    public SessionStatus getStatus() {
        return status;
    }

    public SessionStatus getPreviousStatus() {
        return previousStatus;
    }

    public Position getPosition() {
        return position;
    }

    public ClosedTrade getClosedTrade() {
        return closedTrade;
    }

    public EquityPoint getEquityPoint() {
        return equityPoint;
    }

    /** Human-readable text for ALERT events and the reason of a stop. */
    public String getMessage() {
        return message;
    }
}
