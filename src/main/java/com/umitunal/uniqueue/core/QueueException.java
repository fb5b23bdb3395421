package com.umitunal.uniqueue.core;

/**
 * Base class of the errors raised by the queue core.
 */
public class QueueException extends Exception {

    public QueueException(String message) {
        super(message);
    }

    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
