package com.tradesim.api.controller;

import com.tradesim.api.dto.request.BacktestRequest;
import com.tradesim.api.dto.response.SessionResponse;
import com.tradesim.engine.SimulationEngine;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Starts backtests. The replay runs in the background; poll GET /api/sessions/{id} until the
 * session reports STOPPED for the final results.
 */
@RestController
@RequestMapping("/api/backtests")
public class BacktestController {

    private final SimulationEngine simulationEngine;

    public BacktestController(SimulationEngine simulationEngine) {
        this.simulationEngine = simulationEngine;
    }

    @PostMapping
    public ResponseEntity<SessionResponse> start(@Valid @RequestBody BacktestRequest request) {
        SessionResponse response = SessionResponse.summary(simulationEngine.create(request.toConfig()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
}
