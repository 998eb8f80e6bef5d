package com.faasrt.exception;

/**
 * Unrecoverable problem found before the poll loop starts: missing or broken
 * handler module, invalid configuration. The process exits non-zero.
 */
public class StartupException extends RuntimeException {

    public StartupException(String message) {
        super(message);
    }

    public StartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
