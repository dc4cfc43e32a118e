package org.example.assignment.controller;

import org.example.assignment.service.gate.ConnectionStatus;
import org.example.assignment.service.gate.ReadinessGate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/connection")
public class ConnectionController {

    private final ReadinessGate readinessGate;

    public ConnectionController(ReadinessGate readinessGate) {
        this.readinessGate = readinessGate;
    }

    @GetMapping
    public ConnectionStatus status() {
        return readinessGate.status();
    }

    /**
     * Manual reconnect. Not accepted while a reconnect is running or within the debounce window.
     */
    @PostMapping("/retry")
    public ResponseEntity<RetryResponse> retry() {
        boolean accepted = readinessGate.retryConnection();
        RetryResponse body = new RetryResponse(accepted, readinessGate.status());
        return accepted ? ResponseEntity.accepted().body(body) : ResponseEntity.ok(body);
    }

    public record RetryResponse(boolean accepted, ConnectionStatus status) {
    }
}
