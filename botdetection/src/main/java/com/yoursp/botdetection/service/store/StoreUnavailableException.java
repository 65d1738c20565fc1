package com.yoursp.botdetection.service.store;

/**
 * Thrown when the key-value store cannot serve a request.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
