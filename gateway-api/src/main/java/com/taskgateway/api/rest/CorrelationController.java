package com.taskgateway.api.rest;

import com.taskgateway.core.exception.NotFoundException;
import com.taskgateway.core.model.PendingCorrelation;
import com.taskgateway.engine.service.CorrelationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;

/**
 * Registration of workflow instances waiting for a callback.
 */
@RestController
@RequestMapping("/api/v1/correlations")
public class CorrelationController {

    private final CorrelationService correlationService;

    public CorrelationController(CorrelationService correlationService) {
        this.correlationService = correlationService;
    }

    /**
     * Register a pending correlation. A callback already received for the key is correlated at once.
     */
    @PostMapping
    public ResponseEntity<CorrelationResponse> register(@RequestBody RegisterRequest request) {
        PendingCorrelation pending = correlationService.register(
            request.correlationKey(),
            request.workflowInstanceReference(),
            request.businessKey(),
            request.messageName(),
            request.ttl()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(CorrelationResponse.from(pending));
    }

    /**
     * Cancel a pending correlation, e.g. when the waiting workflow instance terminates.
     */
    @DeleteMapping("/{correlationKey}")
    public ResponseEntity<Void> cancel(@PathVariable String correlationKey) {
        if (!correlationService.cancel(correlationKey)) {
            throw new NotFoundException("PendingCorrelation", correlationKey);
        }
        return ResponseEntity.noContent().build();
    }

    // ========== DTOs ==========

    public record RegisterRequest(
        String correlationKey,
        String workflowInstanceReference,
        String businessKey,
        String messageName,
        Duration ttl
    ) {}

    public record CorrelationResponse(
        String correlationKey,
        String workflowInstanceReference,
        String businessKey,
        String messageName,
        Instant registeredAt,
        Instant expiresAt
    ) {
        public static CorrelationResponse from(PendingCorrelation pending) {
            return new CorrelationResponse(
                pending.correlationKey(),
                pending.workflowInstanceReference(),
                pending.businessKey(),
                pending.messageName(),
                pending.registeredAt(),
                pending.expiresAt()
            );
        }
    }
}
