package com.tradesim.api.controller;

import com.tradesim.api.dto.request.CreateSessionRequest;
import com.tradesim.api.dto.response.SessionResponse;
import com.tradesim.domain.enums.SessionMode;
import com.tradesim.engine.SimulationEngine;
import com.tradesim.exception.ValidationException;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for simulation session lifecycle.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/sessions -- create and start a PAPER or LIVE session</li>
 *   <li>GET /api/sessions -- list sessions (summary view)</li>
 *   <li>GET /api/sessions/{id} -- session detail with trade log and equity curve</li>
 *   <li>POST /api/sessions/{id}/pause -- stop processing, keep the subscription</li>
 *   <li>POST /api/sessions/{id}/resume -- resume a paused session</li>
 *   <li>POST /api/sessions/{id}/stop -- close positions and stop (idempotent)</li>
 *   <li>DELETE /api/sessions/{id}?onlyIfStopped=true -- remove a session record</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SimulationEngine simulationEngine;

    public SessionController(SimulationEngine simulationEngine) {
        this.simulationEngine = simulationEngine;
    }

    @PostMapping
    public ResponseEntity<SessionResponse> create(@Valid @RequestBody CreateSessionRequest request) {
        if (request.getMode() == SessionMode.BACKTEST) {
            throw new ValidationException("Backtests are started through POST /api/backtests");
        }
        SessionResponse response = SessionResponse.summary(simulationEngine.create(request.toConfig()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<SessionResponse>> list() {
        return ResponseEntity.ok(
                simulationEngine.list().stream().map(SessionResponse::summary).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<SessionResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(SessionResponse.detail(simulationEngine.get(id)));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<SessionResponse> pause(@PathVariable String id) {
        return ResponseEntity.ok(SessionResponse.summary(simulationEngine.pause(id)));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<SessionResponse> resume(@PathVariable String id) {
        return ResponseEntity.ok(SessionResponse.summary(simulationEngine.resume(id)));
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<SessionResponse> stop(@PathVariable String id) {
        return ResponseEntity.ok(SessionResponse.detail(simulationEngine.stop(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @PathVariable String id, @RequestParam(defaultValue = "true") boolean onlyIfStopped) {
        simulationEngine.delete(id, onlyIfStopped);
        return ResponseEntity.noContent().build();
    }
}
