package com.umitunal.uniqueue.core;

/**
 * A submission was malformed and was rejected before anything was persisted.
 */
public class InvalidJobException extends QueueException {

    public InvalidJobException(String message) {
        super(message);
    }
}
