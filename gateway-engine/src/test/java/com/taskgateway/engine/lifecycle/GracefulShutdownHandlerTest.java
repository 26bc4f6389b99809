package com.taskgateway.engine.lifecycle;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class GracefulShutdownHandlerTest {

    @Test
    void shutdown_shouldStopComponentsInReverseOrderOnce() {
        List<String> stopped = new ArrayList<>();
        GracefulShutdownHandler handler = new GracefulShutdownHandler("node-1");
        handler.register("dispatcher", () -> stopped.add("dispatcher"));
        handler.register("recovery", () -> stopped.add("recovery"));
        handler.register("adapter", () -> stopped.add("adapter"));

        handler.shutdown();
        handler.shutdown();

        assertThat(stopped).containsExactly("adapter", "recovery", "dispatcher");
        assertThat(handler.isShuttingDown()).isTrue();
    }

    @Test
    void shutdown_shouldContinuePastFailingComponent() {
        List<String> stopped = new ArrayList<>();
        GracefulShutdownHandler handler = new GracefulShutdownHandler("node-1");
        handler.register("dispatcher", () -> stopped.add("dispatcher"));
        handler.register("broken", () -> {
            throw new IllegalStateException("boom");
        });

        handler.shutdown();

        assertThat(stopped).containsExactly("dispatcher");
    }
}
