package com.taskgateway.engine.correlation;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgateway.core.exception.NotFoundException;
import com.taskgateway.core.exception.SignalDeliveryException;
import com.taskgateway.core.exception.TaskValidationException;
import com.taskgateway.core.model.CallbackRecord;
import com.taskgateway.core.model.PendingCorrelation;
import com.taskgateway.core.model.TypedVariable;
import com.taskgateway.core.repository.CallbackRecordRepository;
import com.taskgateway.core.repository.PendingCorrelationRepository;
import com.taskgateway.engine.logging.LoggingContext;
import com.taskgateway.engine.metrics.GatewayMetrics;
import com.taskgateway.engine.service.CorrelationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Matches callbacks from external systems with workflow instances waiting on them.
 * 
 * A callback is stored before it is acknowledged and correlated afterwards. The pending
 * correlation is consumed atomically before the signal goes out, so of any number of
 * concurrent processors only one sends it. Callbacks that find no pending correlation stay
 * unmatched until a registration or the reconciliation sweep picks them up, or until they
 * outlive the retention window.
 */
public class CallbackCorrelator implements CorrelationService {

    private static final Logger log = LoggerFactory.getLogger(CallbackCorrelator.class);

    private final CallbackRecordRepository callbackRepository;
    private final PendingCorrelationRepository pendingRepository;
    private final Map<String, CallbackSource> sources;
    private final PayloadFingerprint fingerprint;
    private final ResumeSignalSender signalSender;
    private final Executor processingExecutor;
    private final Clock clock;
    private final Duration retention;
    private final Duration defaultPendingTtl;
    private final GatewayMetrics metrics;

    public CallbackCorrelator(
            CallbackRecordRepository callbackRepository,
            PendingCorrelationRepository pendingRepository,
            Map<String, CallbackSource> sources,
            PayloadFingerprint fingerprint,
            ResumeSignalSender signalSender,
            Executor processingExecutor,
            Clock clock,
            Duration retention,
            Duration defaultPendingTtl,
            GatewayMetrics metrics) {
        this.callbackRepository = callbackRepository;
        this.pendingRepository = pendingRepository;
        this.sources = Map.copyOf(sources);
        this.fingerprint = fingerprint;
        this.signalSender = signalSender;
        this.processingExecutor = processingExecutor;
        this.clock = clock;
        this.retention = retention;
        this.defaultPendingTtl = defaultPendingTtl;
        this.metrics = metrics;
    }

    @Override
    public Receipt receive(String sourceName, JsonNode rawPayload) {
        CallbackSource source = Optional.ofNullable(sources.get(sourceName))
            .orElseThrow(() -> new NotFoundException("CallbackSource", sourceName));
        if (rawPayload == null || !rawPayload.isObject()) {
            throw new TaskValidationException("Callback payload must be a JSON object");
        }
        JsonNode keyNode = rawPayload.at(source.correlationKeyPointer());
        if (keyNode.isMissingNode() || keyNode.isNull() || keyNode.asText().isBlank()) {
            throw new TaskValidationException(
                "Callback payload has no correlation key at " + source.correlationKeyPointer());
        }
        String correlationKey = keyNode.asText();

        CallbackRecord candidate = CallbackRecord.create(
            source.name(),
            correlationKey,
            rawPayload,
            fingerprint.hash(rawPayload, source.ignoredFields()),
            clock.instant()
        );
        CallbackRecordRepository.InsertResult stored = callbackRepository.insertIfAbsent(candidate);
        CallbackRecord callback = stored.record();

        try (LoggingContext ctx = LoggingContext.forCallback(callback.callbackId(), correlationKey)) {
            if (stored.duplicate()) {
                callbackRepository.incrementDeliveryCount(callback.callbackId());
                log.info("Duplicate callback from {} (signalSent={})", source.name(), callback.signalSent());
            } else {
                log.info("Stored callback from {}", source.name());
            }
        }
        metrics.callbackReceived(source.name(), stored.duplicate());

        if (callback.isAwaitingSignal()) {
            scheduleProcessing(callback.callbackId());
        }
        return new Receipt(callback.callbackId(), stored.duplicate());
    }

    @Override
    public CallbackRecord process(String callbackId) {
        CallbackRecord callback = callbackRepository.findById(callbackId)
            .orElseThrow(() -> new NotFoundException("Callback", callbackId));

        try (LoggingContext ctx = LoggingContext.forCallback(callbackId, callback.correlationKey())) {
            if (callback.isTerminal()) {
                log.debug("Callback already final (signalSent={}, expired={})",
                    callback.signalSent(), callback.expired());
                return callback;
            }

            Instant now = clock.instant();
            Optional<PendingCorrelation> consumed = pendingRepository.consume(callback.correlationKey())
                .filter(pending -> !pending.isExpired(now));
            if (consumed.isEmpty()) {
                CallbackRecord unmatched = callback.withUnmatched(now, null);
                callbackRepository.update(unmatched);
                log.info("No pending correlation yet, callback retained");
                return unmatched;
            }

            PendingCorrelation pending = consumed.get();
            CallbackSource source = sourceOf(callback);
            ResumeSignal signal = buildSignal(source, callback, pending, now);
            try {
                signalSender.send(signal);
            } catch (SignalDeliveryException e) {
                pendingRepository.register(pending);
                CallbackRecord failed = callback.withUnmatched(now, e.getMessage());
                callbackRepository.update(failed);
                metrics.signalFailed(signal.messageName());
                log.warn("Resume signal {} not delivered, will retry: {}", signal.messageName(), e.getMessage());
                return failed;
            }

            CallbackRecord sent = callback.withSignalSent(now);
            if (!callbackRepository.update(sent)) {
                log.warn("Resume signal {} sent but callback was already final, record not marked as signalled",
                    signal.messageName());
            }
            metrics.signalSent(signal.messageName());
            log.info("Resume signal {} sent to {}", signal.messageName(), pending.workflowInstanceReference());
            return sent;
        }
    }

    @Override
    public PendingCorrelation register(String correlationKey, String workflowInstanceReference,
                                       String businessKey, String messageName, Duration ttl) {
        if (correlationKey == null || correlationKey.isBlank()) {
            throw new TaskValidationException("correlationKey is required");
        }
        if (workflowInstanceReference == null || workflowInstanceReference.isBlank()) {
            throw new TaskValidationException("workflowInstanceReference is required");
        }

        Instant now = clock.instant();
        Duration effectiveTtl = ttl != null ? ttl : defaultPendingTtl;
        PendingCorrelation pending = new PendingCorrelation(
            correlationKey,
            workflowInstanceReference,
            businessKey,
            messageName,
            now,
            effectiveTtl != null ? now.plus(effectiveTtl) : null
        );
        pendingRepository.register(pending);

        try (LoggingContext ctx = LoggingContext.forCallback(null, correlationKey)) {
            log.info("Registered pending correlation for {}", workflowInstanceReference);
            correlateWaitingCallbacks(correlationKey);
        }
        return pending;
    }

    @Override
    public boolean cancel(String correlationKey) {
        boolean removed = pendingRepository.remove(correlationKey);
        if (removed) {
            log.info("Cancelled pending correlation {}", correlationKey);
        }
        return removed;
    }

    @Override
    public CallbackRecord getCallback(String callbackId) {
        return callbackRepository.findById(callbackId)
            .orElseThrow(() -> new NotFoundException("Callback", callbackId));
    }

    /**
     * Expire callbacks past the retention window, then re-attempt correlation for callbacks that
     * were never processed or whose correlation key now has a pending correlation.
     */
    public ReconcileResult reconcile(int batchSize) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(retention);
        int signalled = 0;
        int expired = 0;
        int failed = 0;

        List<CallbackRecord> lapsed = callbackRepository.findAwaitingSignalReceivedBefore(cutoff, batchSize);
        for (CallbackRecord callback : lapsed) {
            try {
                if (callbackRepository.update(callback.withExpired(now))) {
                    expired++;
                    metrics.callbackExpired(callback.source());
                    log.warn("Callback {} for key {} expired unmatched after {}",
                        callback.callbackId(), callback.correlationKey(), retention);
                }
            } catch (Exception e) {
                failed++;
                log.error("Failed to expire callback {}", callback.callbackId(), e);
            }
        }

        List<CallbackRecord> correlatable = callbackRepository.findCorrelatable(now, batchSize);
        for (CallbackRecord callback : correlatable) {
            if (!callback.receivedAt().isAfter(cutoff)) {
                // left for the next expiry pass
                continue;
            }
            try {
                if (process(callback.callbackId()).signalSent()) {
                    signalled++;
                }
            } catch (Exception e) {
                failed++;
                log.error("Failed to reconcile callback {}", callback.callbackId(), e);
            }
        }
        return new ReconcileResult(lapsed.size() + correlatable.size(), signalled, expired, failed);
    }

    /**
     * Drop pending correlations past their expiry.
     */
    public int expirePendingCorrelations() {
        int removed = pendingRepository.deleteExpired(clock.instant());
        if (removed > 0) {
            log.info("Removed {} expired pending correlations", removed);
        }
        return removed;
    }

    public long countAwaitingSignal() {
        return callbackRepository.countAwaitingSignal();
    }

    // ========== Helper Methods ==========

    private void scheduleProcessing(String callbackId) {
        try {
            processingExecutor.execute(() -> {
                try {
                    process(callbackId);
                } catch (Exception e) {
                    log.error("Processing of callback {} failed; reconciliation will retry", callbackId, e);
                }
            });
        } catch (RuntimeException e) {
            log.warn("Could not schedule callback {}; reconciliation will pick it up", callbackId, e);
        }
    }

    private void correlateWaitingCallbacks(String correlationKey) {
        for (CallbackRecord callback : callbackRepository.findByCorrelationKey(correlationKey)) {
            if (!callback.isAwaitingSignal()) {
                continue;
            }
            try {
                CallbackRecord result = process(callback.callbackId());
                if (result.signalSent() || pendingRepository.find(correlationKey).isEmpty()) {
                    return;
                }
            } catch (Exception e) {
                log.warn("Immediate correlation of callback {} failed; reconciliation will retry",
                    callback.callbackId(), e);
                return;
            }
        }
    }

    private CallbackSource sourceOf(CallbackRecord callback) {
        CallbackSource configured = sources.get(callback.source());
        if (configured != null) {
            return configured;
        }
        log.warn("Callback source {} is no longer configured, using bare defaults", callback.source());
        return new CallbackSource(callback.source(), "/correlation_key", callback.source(), "", List.of(), null);
    }

    private ResumeSignal buildSignal(CallbackSource source, CallbackRecord callback,
                                     PendingCorrelation pending, Instant now) {
        JsonNode payload = callback.rawPayload();
        String prefix = source.variablePrefix();

        Map<String, TypedVariable> variables = new LinkedHashMap<>();
        for (String field : source.signalFields()) {
            JsonNode value = field.startsWith("/") ? payload.at(field) : payload.path(field);
            if (!value.isMissingNode()) {
                variables.put(prefix + variableName(field), TypedVariable.fromJson(value));
            }
        }
        variables.put(prefix + "payload", new TypedVariable(payload.toString(), "Json"));
        variables.put(prefix + "callback_id", TypedVariable.string(callback.callbackId()));
        variables.put(prefix + "timestamp_callback", TypedVariable.string(now.toString()));

        String messageName = pending.messageName() != null ? pending.messageName() : source.messageName();
        return new ResumeSignal(messageName, pending.businessKey(), pending.workflowInstanceReference(), variables);
    }

    private static String variableName(String field) {
        return field.startsWith("/") ? field.substring(1).replace('/', '_') : field;
    }

    /**
     * Counts from one reconciliation pass.
     */
    public record ReconcileResult(int examined, int signalled, int expired, int failed) {}
}
