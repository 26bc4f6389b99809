package com.taskgateway.client.http;

import com.taskgateway.core.model.ErrorClass;
import java.util.Set;

/**
 * Maps HTTP status codes onto the gateway's error classes.
 */
public final class ResponseClassifier {

    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 429, 500, 502, 503, 504);

    private ResponseClassifier() {
    }

    /**
     * @return the error class, or null for a 2xx response
     */
    public static ErrorClass classify(int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return null;
        }
        if (statusCode == 401 || statusCode == 403) {
            return ErrorClass.AUTHENTICATION_EXPIRED;
        }
        if (TRANSIENT_STATUSES.contains(statusCode)) {
            return ErrorClass.TRANSIENT_TRANSPORT;
        }
        return ErrorClass.BUSINESS_REJECTED;
    }
}
