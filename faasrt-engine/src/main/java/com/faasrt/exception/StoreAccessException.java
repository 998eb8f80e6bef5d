package com.faasrt.exception;

/**
 * A GET or SET against the store failed. Recoverable: the loop logs it and polls again later.
 */
public class StoreAccessException extends RuntimeException {

    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
