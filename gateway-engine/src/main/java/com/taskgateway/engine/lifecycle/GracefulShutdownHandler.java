package com.taskgateway.engine.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown for the gateway.
 * 
 * On shutdown the registered background loops (external-task adapter, recovery sweeps,
 * dispatcher) are stopped in reverse registration order, so producers stop before the
 * pool that consumes their work. Attempts cut short by the grace period keep their lease
 * and are reclaimed by another instance once it expires.
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final Map<String, Runnable> stopActions = Collections.synchronizedMap(new LinkedHashMap<>());
    private final String nodeId;

    public GracefulShutdownHandler(String nodeId) {
        this.nodeId = nodeId;
    }

    /**
     * Register a component to stop on shutdown.
     */
    public void register(String name, Runnable stopAction) {
        stopActions.put(name, stopAction);
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Handle application shutdown event.
     * This runs before Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0) // Run early in shutdown sequence
    public void onShutdown(ContextClosedEvent event) {
        shutdown();
    }

    /**
     * Stop every registered component once.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown for node: {}", nodeId);

        List<Map.Entry<String, Runnable>> ordered;
        synchronized (stopActions) {
            ordered = new ArrayList<>(stopActions.entrySet());
        }
        Collections.reverse(ordered);

        int failed = 0;
        for (Map.Entry<String, Runnable> entry : ordered) {
            try {
                log.info("Stopping {}", entry.getKey());
                entry.getValue().run();
            } catch (Exception e) {
                failed++;
                log.error("Failed to stop {}", entry.getKey(), e);
            }
        }

        log.info("Graceful shutdown complete for node: {} ({} of {} components failed to stop)",
            nodeId, failed, ordered.size());
    }
}
