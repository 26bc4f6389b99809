package com.taskgateway.worker.engine;

import com.taskgateway.core.exception.GatewayException;

/**
 * Thrown when the workflow engine cannot be reached or rejects an external-task call.
 */
public class EngineClientException extends GatewayException {

    public static final String ERROR_CODE = "ENGINE_UNAVAILABLE";

    private final int statusCode;

    public EngineClientException(String message, int statusCode) {
        super(ERROR_CODE, message);
        this.statusCode = statusCode;
    }

    public EngineClientException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.statusCode = 0;
    }

    /**
     * HTTP status of the rejection, or 0 when the engine was not reached.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
