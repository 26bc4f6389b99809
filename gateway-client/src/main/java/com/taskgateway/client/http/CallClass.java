package com.taskgateway.client.http;

import com.taskgateway.core.model.RetryPolicy;
import java.time.Duration;

/**
 * Timeout and retry budget for a family of calls, e.g. known-slow queries.
 */
public record CallClass(String name, Duration timeout, RetryPolicy retryPolicy) {

    public static final String DEFAULT = "default";

    public static CallClass defaults() {
        return new CallClass(DEFAULT, Duration.ofSeconds(60), RetryPolicy.callDefault());
    }
}
