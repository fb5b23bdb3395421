package com.umitunal.uniqueue.handler;

/**
 * Thrown by a handler to fail its job without further retries.
 * Any other exception escaping a handler counts as a recoverable failure.
 */
public class UnrecoverableJobException extends Exception {

    public UnrecoverableJobException(String message) {
        super(message);
    }

    public UnrecoverableJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
