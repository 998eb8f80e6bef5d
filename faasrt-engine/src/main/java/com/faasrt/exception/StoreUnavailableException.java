package com.faasrt.exception;

/**
 * Thrown by the poll loop when a bounded {@link com.faasrt.config.StoreRetryPolicy} runs out.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
