package com.taskgateway.worker.gateway;

import com.taskgateway.core.exception.GatewayException;

/**
 * Thrown when the gateway cannot be reached or answers with an unexpected status.
 */
public class GatewayClientException extends GatewayException {

    public static final String ERROR_CODE = "GATEWAY_UNAVAILABLE";

    public GatewayClientException(String message) {
        super(ERROR_CODE, message);
    }

    public GatewayClientException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
