package com.taskgateway.testsupport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Controllable {@link Clock} for testing time-dependent behavior.
 * Lets tests move time forward without actually waiting.
 * 
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = TimeController.frozenAt(Instant.parse("2024-01-15T10:00:00Z"));
 * CredentialCache cache = new CredentialCache(issuer, store, Duration.ofSeconds(60), time);
 * time.advance(Duration.ofMinutes(5));
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;
    private final ZoneId zone;

    public TimeController(Instant startTime) {
        this(new AtomicReference<>(startTime), ZoneOffset.UTC);
    }

    private TimeController(AtomicReference<Instant> currentTime, ZoneId zone) {
        this.currentTime = currentTime;
        this.zone = zone;
    }

    public static TimeController frozenAt(Instant time) {
        return new TimeController(time);
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Views share the same underlying time.
     */
    @Override
    public Clock withZone(ZoneId zone) {
        return new TimeController(currentTime, zone);
    }

    public void advance(Duration duration) {
        currentTime.updateAndGet(t -> t.plus(duration));
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    public void advanceMinutes(long minutes) {
        advance(Duration.ofMinutes(minutes));
    }

    public void setTime(Instant newTime) {
        currentTime.set(newTime);
    }
}
