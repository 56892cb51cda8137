package com.tradesim.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradesim.api.controller.SessionController;
import com.tradesim.config.ApiResponseAdvice;
import com.tradesim.domain.enums.ExitReason;
import com.tradesim.domain.enums.PositionSide;
import com.tradesim.domain.enums.SessionMode;
import com.tradesim.domain.enums.SessionStatus;
import com.tradesim.domain.model.ClosedTrade;
import com.tradesim.domain.model.EquityPoint;
import com.tradesim.domain.model.SessionConfig;
import com.tradesim.domain.model.SessionSnapshot;
import com.tradesim.engine.SimulationEngine;
import com.tradesim.exception.CapacityExceededException;
import com.tradesim.exception.GlobalExceptionHandler;
import com.tradesim.exception.ResourceNotFoundException;
import com.tradesim.exception.SessionStateException;
import com.tradesim.exception.ValidationException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for {@link SessionController}, with the success envelope and the
 * exception handler wired in.
 */
@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    private static final Instant CREATED = Instant.parse("2024-08-01T09:00:00Z");

    private MockMvc mockMvc;

    @Mock
    private SimulationEngine simulationEngine;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SessionController(simulationEngine))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static SessionSnapshot snapshot(String id, SessionStatus status, List<ClosedTrade> trades) {
        SessionConfig config = SessionConfig.builder()
                .name("momentum")
                .symbol("BTCUSDT")
                .mode(SessionMode.PAPER)
                .initialCapital(new BigDecimal("10000"))
                .build();
        return SessionSnapshot.builder()
                .id(id)
                .config(config)
                .status(status)
                .initialCapital(new BigDecimal("10000"))
                .currentCapital(new BigDecimal("10000").add(trades.stream()
                        .map(ClosedTrade::getRealizedPnl)
                        .reduce(BigDecimal.ZERO, BigDecimal::add)))
                .openPositions(List.of())
                .closedTrades(trades)
                .equityCurve(List.of(EquityPoint.builder()
                        .timestamp(CREATED)
                        .equity(new BigDecimal("10000"))
                        .cash(new BigDecimal("10000"))
                        .unrealizedPnl(BigDecimal.ZERO)
                        .build()))
                .createdAt(CREATED)
                .build();
    }

    private static ClosedTrade trade() {
        return ClosedTrade.builder()
                .positionId("P1")
                .symbol("BTCUSDT")
                .side(PositionSide.LONG)
                .entryPrice(new BigDecimal("100"))
                .quantity(new BigDecimal("100"))
                .notionalAtEntry(new BigDecimal("10000"))
                .exitPrice(new BigDecimal("110"))
                .exitReason(ExitReason.SIGNAL)
                .realizedPnl(new BigDecimal("979"))
                .feesPaid(new BigDecimal("21"))
                .pnlPercent(new BigDecimal("9.79"))
                .build();
    }

    @Test
    @DisplayName("POST /api/sessions creates a paper session and returns 201")
    void createSession() throws Exception {
        when(simulationEngine.create(any(SessionConfig.class))).thenReturn(snapshot("s-1", SessionStatus.ACTIVE, List.of()));

        String body = """
                {
                    "name": "momentum",
                    "symbol": "BTCUSDT",
                    "initialCapital": 10000,
                    "stopLossPercent": 5
                }
                """;

        mockMvc.perform(post("/api/sessions").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value("s-1"))
                .andExpect(jsonPath("$.data.status").value("ACTIVE"))
                .andExpect(jsonPath("$.data.mode").value("PAPER"))
                .andExpect(jsonPath("$.data.closedTrades").doesNotExist());

        verify(simulationEngine).create(argThat(config -> config.getMode() == SessionMode.PAPER
                && config.getRisk().getStopLossPercent().compareTo(new BigDecimal("5")) == 0));
    }

    @Test
    @DisplayName("POST /api/sessions rejects a missing symbol with field details")
    void createRejectsInvalidBody() throws Exception {
        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"initialCapital\": -5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.symbol").exists())
                .andExpect(jsonPath("$.error.details.initialCapital").exists());

        verify(simulationEngine, never()).create(any());
    }

    @Test
    @DisplayName("POST /api/sessions refuses BACKTEST mode")
    void createRejectsBacktestMode() throws Exception {
        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"BTCUSDT\",\"initialCapital\":100,\"mode\":\"BACKTEST\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("Backtests are started through POST /api/backtests"));
    }

    @Test
    @DisplayName("Engine validation errors surface as 400 with the collected messages")
    void engineValidationError() throws Exception {
        when(simulationEngine.create(any())).thenThrow(new ValidationException(
                "Invalid session config: stopLossPercent must be in (0, 100]",
                Map.of("errors", List.of("stopLossPercent must be in (0, 100]"))));

        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"BTCUSDT\",\"initialCapital\":100,\"stopLossPercent\":500}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details.errors[0]").value("stopLossPercent must be in (0, 100]"));
    }

    @Test
    @DisplayName("Capacity exhaustion maps to 503")
    void capacityExhausted() throws Exception {
        when(simulationEngine.create(any())).thenThrow(new CapacityExceededException(64));

        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"BTCUSDT\",\"initialCapital\":100}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("CAPACITY_EXHAUSTED"));
    }

    @Test
    @DisplayName("GET /api/sessions lists summaries")
    void listSessions() throws Exception {
        when(simulationEngine.list()).thenReturn(List.of(
                snapshot("s-1", SessionStatus.ACTIVE, List.of()), snapshot("s-2", SessionStatus.STOPPED, List.of(trade()))));

        mockMvc.perform(get("/api/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[1].id").value("s-2"))
                .andExpect(jsonPath("$.data[1].realizedPnl").value(979))
                .andExpect(jsonPath("$.data[1].performance.totalTrades").value(1))
                .andExpect(jsonPath("$.data[1].closedTrades").doesNotExist());
    }

    @Test
    @DisplayName("GET /api/sessions/{id} returns the trade log and equity curve")
    void getSessionDetail() throws Exception {
        when(simulationEngine.get("s-2")).thenReturn(snapshot("s-2", SessionStatus.STOPPED, List.of(trade())));

        mockMvc.perform(get("/api/sessions/s-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.closedTrades.length()").value(1))
                .andExpect(jsonPath("$.data.closedTrades[0].exitReason").value("SIGNAL"))
                .andExpect(jsonPath("$.data.equityCurve.length()").value(1))
                .andExpect(jsonPath("$.data.currentCapital").value(10979));
    }

    @Test
    @DisplayName("Unknown session is 404")
    void unknownSession() throws Exception {
        when(simulationEngine.get("nope")).thenThrow(new ResourceNotFoundException("Session", "nope"));

        mockMvc.perform(get("/api/sessions/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Pause, resume and stop delegate to the engine")
    void lifecycleCommands() throws Exception {
        when(simulationEngine.pause("s-1")).thenReturn(snapshot("s-1", SessionStatus.PAUSED, List.of()));
        when(simulationEngine.resume("s-1")).thenReturn(snapshot("s-1", SessionStatus.ACTIVE, List.of()));
        when(simulationEngine.stop("s-1")).thenReturn(snapshot("s-1", SessionStatus.STOPPED, List.of(trade())));

        mockMvc.perform(post("/api/sessions/s-1/pause"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("PAUSED"));
        mockMvc.perform(post("/api/sessions/s-1/resume"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("ACTIVE"));
        mockMvc.perform(post("/api/sessions/s-1/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("STOPPED"))
                .andExpect(jsonPath("$.data.closedTrades.length()").value(1));
    }

    @Test
    @DisplayName("Invalid transitions are 409")
    void invalidTransition() throws Exception {
        when(simulationEngine.resume("s-1")).thenThrow(new SessionStateException("s-1", SessionStatus.STOPPED, "resume"));

        mockMvc.perform(post("/api/sessions/s-1/resume"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("INVALID_STATE"))
                .andExpect(jsonPath("$.error.details.status").value("STOPPED"));
    }

    @Test
    @DisplayName("DELETE defaults to onlyIfStopped=true and returns 204")
    void deleteSession() throws Exception {
        mockMvc.perform(delete("/api/sessions/s-1")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/sessions/s-2").param("onlyIfStopped", "false")).andExpect(status().isNoContent());

        verify(simulationEngine).delete("s-1", true);
        verify(simulationEngine).delete("s-2", false);
    }
}
