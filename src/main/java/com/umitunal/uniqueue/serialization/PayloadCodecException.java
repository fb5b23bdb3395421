package com.umitunal.uniqueue.serialization;

/**
 * A payload could not be encoded or decoded. A payload that fails to decode is malformed,
 * so jobs failing this way are not retried.
 */
public class PayloadCodecException extends RuntimeException {

    public PayloadCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
