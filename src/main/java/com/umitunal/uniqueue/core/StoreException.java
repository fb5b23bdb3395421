package com.umitunal.uniqueue.core;

/**
 * The job store could not complete an operation. Callers treat it as transient.
 */
public class StoreException extends QueueException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
