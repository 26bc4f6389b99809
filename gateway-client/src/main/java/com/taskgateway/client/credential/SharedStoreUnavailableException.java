package com.taskgateway.client.credential;

/**
 * Raised by a {@link SharedTokenStore} that cannot be reached.
 */
public class SharedStoreUnavailableException extends RuntimeException {

    public SharedStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
