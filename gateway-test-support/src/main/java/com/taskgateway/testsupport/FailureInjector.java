package com.taskgateway.testsupport;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scripted failure injection for fakes of flaky collaborators.
 * 
 * <p>Example usage:</p>
 * <pre>{@code
 * FailureInjector injector = FailureInjector.failFirst(2);
 * // inside a fake transport
 * injector.maybeThrow(() -> new HttpTimeoutException("injected"));
 * }</pre>
 */
public class FailureInjector {

    private final Deque<Boolean> script = new ArrayDeque<>();
    private final boolean failWhenScriptExhausted;
    private final AtomicInteger invocationCount = new AtomicInteger();
    private final AtomicInteger failureCount = new AtomicInteger();

    private FailureInjector(boolean failWhenScriptExhausted) {
        this.failWhenScriptExhausted = failWhenScriptExhausted;
    }

    /**
     * Fail the first {@code n} invocations, then succeed.
     */
    public static FailureInjector failFirst(int n) {
        FailureInjector injector = new FailureInjector(false);
        for (int i = 0; i < n; i++) {
            injector.script.add(true);
        }
        return injector;
    }

    public static FailureInjector alwaysFail() {
        return new FailureInjector(true);
    }

    public static FailureInjector neverFail() {
        return new FailureInjector(false);
    }

    /**
     * Decide whether the current invocation fails, consuming one script step.
     */
    public synchronized boolean shouldFail() {
        invocationCount.incrementAndGet();
        Boolean next = script.poll();
        boolean fail = next != null ? next : failWhenScriptExhausted;
        if (fail) {
            failureCount.incrementAndGet();
        }
        return fail;
    }

    public <E extends Exception> void maybeThrow(Supplier<E> failure) throws E {
        if (shouldFail()) {
            throw failure.get();
        }
    }

    public int getInvocationCount() {
        return invocationCount.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }
}
