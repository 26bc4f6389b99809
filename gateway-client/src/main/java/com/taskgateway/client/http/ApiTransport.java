package com.taskgateway.client.http;

import java.io.IOException;
import java.time.Duration;

/**
 * Sends a single HTTP exchange. Implementations do not retry.
 */
public interface ApiTransport {

    /**
     * @param bearerToken token to attach, or null for unauthenticated calls
     * @param timeout     upper bound for the whole exchange
     * @throws java.net.http.HttpTimeoutException when the timeout elapses
     * @throws IOException on connection failures
     */
    ApiResponse send(ApiEndpoint endpoint, ApiRequest request, String bearerToken, Duration timeout)
        throws IOException, InterruptedException;
}
