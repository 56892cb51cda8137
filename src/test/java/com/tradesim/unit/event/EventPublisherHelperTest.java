package com.tradesim.unit.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.tradesim.domain.enums.ExitReason;
import com.tradesim.domain.enums.PositionSide;
import com.tradesim.domain.enums.SessionStatus;
import com.tradesim.domain.model.ClosedTrade;
import com.tradesim.domain.model.EquityPoint;
import com.tradesim.domain.model.Position;
import com.tradesim.event.EventPublisherHelper;
import com.tradesim.event.SessionEvent;
import com.tradesim.event.SessionEventType;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for {@link EventPublisherHelper}.
 *
 * <p>Each typed publish method must produce a {@link SessionEvent} of the matching type with
 * only its own payload set.
 */
@ExtendWith(MockitoExtension.class)
class EventPublisherHelperTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private EventPublisherHelper eventPublisherHelper;

    @BeforeEach
    void setUp() {
        eventPublisherHelper = new EventPublisherHelper(applicationEventPublisher);
    }

    private SessionEvent captured() {
        ArgumentCaptor<SessionEvent> captor = ArgumentCaptor.forClass(SessionEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("publishSessionCreated carries the initial status")
    void publishSessionCreated() {
        eventPublisherHelper.publishSessionCreated(this, "s-1", SessionStatus.ACTIVE);

        SessionEvent event = captured();
        assertThat(event.getSessionId()).isEqualTo("s-1");
        assertThat(event.getEventType()).isEqualTo(SessionEventType.SESSION_CREATED);
        assertThat(event.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(event.getPreviousStatus()).isNull();
        assertThat(event.getSource()).isSameAs(this);
    }

    @Test
    @DisplayName("publishStatusChanged includes previous status and reason")
    void publishStatusChanged() {
        eventPublisherHelper.publishStatusChanged(this, "s-1", SessionStatus.ACTIVE, SessionStatus.STOPPED, "USER");

        SessionEvent event = captured();
        assertThat(event.getEventType()).isEqualTo(SessionEventType.STATUS_CHANGED);
        assertThat(event.getPreviousStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(event.getStatus()).isEqualTo(SessionStatus.STOPPED);
        assertThat(event.getMessage()).isEqualTo("USER");
    }

    @Test
    @DisplayName("publishPositionOpened carries the position only")
    void publishPositionOpened() {
        Position position = Position.builder()
                .id("P1")
                .symbol("BTCUSDT")
                .side(PositionSide.LONG)
                .entryPrice(new BigDecimal("100"))
                .quantity(BigDecimal.ONE)
                .build();

        eventPublisherHelper.publishPositionOpened(this, "s-1", position);

        SessionEvent event = captured();
        assertThat(event.getEventType()).isEqualTo(SessionEventType.POSITION_OPENED);
        assertThat(event.getPosition()).isSameAs(position);
        assertThat(event.getClosedTrade()).isNull();
        assertThat(event.getStatus()).isNull();
    }

    @Test
    @DisplayName("publishPositionClosed carries the closed trade")
    void publishPositionClosed() {
        ClosedTrade trade = ClosedTrade.builder()
                .positionId("P1")
                .exitReason(ExitReason.STOP_LOSS)
                .realizedPnl(new BigDecimal("-10"))
                .build();

        eventPublisherHelper.publishPositionClosed(this, "s-1", trade);

        SessionEvent event = captured();
        assertThat(event.getEventType()).isEqualTo(SessionEventType.POSITION_CLOSED);
        assertThat(event.getClosedTrade()).isSameAs(trade);
        assertThat(event.getPosition()).isNull();
    }

    @Test
    @DisplayName("publishEquitySample carries the equity point")
    void publishEquitySample() {
        EquityPoint point = EquityPoint.builder()
                .timestamp(Instant.parse("2024-05-01T00:00:00Z"))
                .equity(new BigDecimal("10000"))
                .build();

        eventPublisherHelper.publishEquitySample(this, "s-1", point);

        SessionEvent event = captured();
        assertThat(event.getEventType()).isEqualTo(SessionEventType.EQUITY_SAMPLE);
        assertThat(event.getEquityPoint()).isSameAs(point);
    }

    @Test
    @DisplayName("publishAlert and publishInvariantViolation carry a message")
    void publishAlertAndViolation() {
        eventPublisherHelper.publishAlert(this, "s-1", "Entry order rejected");

        SessionEvent alert = captured();
        assertThat(alert.getEventType()).isEqualTo(SessionEventType.ALERT);
        assertThat(alert.getMessage()).isEqualTo("Entry order rejected");

        EventPublisherHelper fresh = new EventPublisherHelper(event -> {
            SessionEvent sessionEvent = (SessionEvent) event;
            assertThat(sessionEvent.getEventType()).isEqualTo(SessionEventType.INVARIANT_VIOLATION);
            assertThat(sessionEvent.getMessage()).contains("capital");
        });
        fresh.publishInvariantViolation(this, "s-1", "capital drifted by 0.01");
    }
}
