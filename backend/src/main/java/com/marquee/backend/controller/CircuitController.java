package com.marquee.backend.controller;

import com.marquee.backend.dto.CircuitStateUpdateRequest;
import com.marquee.backend.dto.ProviderCircuitStatus;
import com.marquee.backend.exception.BadRequestException;
import com.marquee.backend.exception.NotFoundException;
import com.marquee.backend.model.CircuitBreakerState;
import com.marquee.backend.model.CircuitType;
import com.marquee.backend.service.circuit.CircuitBreakerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/circuits")
@RequiredArgsConstructor
@Tag(name = "Circuits")
public class CircuitController {

    private final CircuitBreakerService circuitBreakerService;

    @GetMapping
    @Operation(summary = "List circuits, optionally filtered by type")
    public ResponseEntity<List<CircuitBreakerState>> list(@RequestParam(required = false) CircuitType type) {
        List<CircuitBreakerState> circuits = type == null
                ? circuitBreakerService.getAllCircuits()
                : circuitBreakerService.getCircuitsByType(type);
        return ResponseEntity.ok(circuits);
    }

    @GetMapping("/{circuitId}")
    @Operation(summary = "Get one circuit")
    public ResponseEntity<CircuitBreakerState> get(@PathVariable String circuitId) {
        return ResponseEntity.ok(require(circuitId));
    }

    @GetMapping("/{circuitId}/provider-status")
    @Operation(summary = "Provider circuit health with reset timeout")
    public ResponseEntity<ProviderCircuitStatus> providerStatus(@PathVariable String circuitId) {
        requireProvider(circuitId);
        return circuitBreakerService.getProviderStatus(circuitId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("Circuit not found: " + circuitId));
    }

    @PutMapping("/{circuitId}/state")
    @Operation(summary = "Set a circuit state")
    public ResponseEntity<CircuitBreakerState> setState(@PathVariable String circuitId,
                                                        @Valid @RequestBody CircuitStateUpdateRequest request) {
        require(circuitId);
        log.info("Circuit state change requested circuitId={} state={}", circuitId, request.state());
        circuitBreakerService.setCircuitState(circuitId, request.state());
        return ResponseEntity.ok(require(circuitId));
    }

    @PostMapping("/{circuitId}/reset")
    @Operation(summary = "Reset a provider circuit to ON with zero counters")
    public ResponseEntity<CircuitBreakerState> reset(@PathVariable String circuitId) {
        requireProvider(circuitId);
        circuitBreakerService.resetProviderCircuit(circuitId);
        return ResponseEntity.ok(require(circuitId));
    }

    private CircuitBreakerState require(String circuitId) {
        return circuitBreakerService.getCircuitStatus(circuitId)
                .orElseThrow(() -> new NotFoundException("Circuit not found: " + circuitId));
    }

    private void requireProvider(String circuitId) {
        if (require(circuitId).getCircuitType() != CircuitType.PROVIDER) {
            throw new BadRequestException("Not a provider circuit: " + circuitId);
        }
    }
}
