package com.taskgateway.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgateway.core.model.CallbackRecord;
import com.taskgateway.engine.service.CorrelationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

/**
 * Webhook for external systems pushing asynchronous results.
 */
@RestController
@RequestMapping("/api/v1/callbacks")
public class CallbackController {

    private final CorrelationService correlationService;

    public CallbackController(CorrelationService correlationService) {
        this.correlationService = correlationService;
    }

    /**
     * Receive a callback. Acknowledged once stored; a redelivered payload is acknowledged again.
     */
    @PostMapping("/{source}")
    public ResponseEntity<CallbackReceipt> receiveCallback(
            @PathVariable String source,
            @RequestBody JsonNode payload) {

        CorrelationService.Receipt receipt = correlationService.receive(source, payload);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(new CallbackReceipt(true, receipt.callbackId(), receipt.duplicate()));
    }

    @GetMapping("/{callbackId}")
    public ResponseEntity<CallbackResponse> getCallback(@PathVariable String callbackId) {
        return ResponseEntity.ok(CallbackResponse.from(correlationService.getCallback(callbackId)));
    }

    // ========== DTOs ==========

    public record CallbackReceipt(boolean received, String callbackId, boolean duplicate) {}

    public record CallbackResponse(
        String callbackId,
        String source,
        String correlationKey,
        JsonNode rawPayload,
        Instant receivedAt,
        boolean processed,
        boolean signalSent,
        boolean expired,
        int deliveryCount,
        Instant processedAt,
        String lastError
    ) {
        public static CallbackResponse from(CallbackRecord callback) {
            return new CallbackResponse(
                callback.callbackId(),
                callback.source(),
                callback.correlationKey(),
                callback.rawPayload(),
                callback.receivedAt(),
                callback.processed(),
                callback.signalSent(),
                callback.expired(),
                callback.deliveryCount(),
                callback.processedAt(),
                callback.lastError()
            );
        }
    }
}
