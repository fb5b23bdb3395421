package com.umitunal.uniqueue.core;

/**
 * No handler is registered for a job type. A submission of such a job is invalid.
 */
public class UnknownTypeException extends InvalidJobException {
    private final String type;

    public UnknownTypeException(String type) {
        super("No handler registered for job type: " + type);
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
