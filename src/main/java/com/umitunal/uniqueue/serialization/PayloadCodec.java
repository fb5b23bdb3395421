package com.umitunal.uniqueue.serialization;

/**
 * Encodes typed payloads into the opaque bytes stored with a job, and back.
 * Submitters and handlers of one job type must agree on the codec.
 *
 * @param <T> the type of payload
 */
public interface PayloadCodec<T> {

    /**
     * Encode a payload to bytes.
     */
    byte[] encode(T payload);

    /**
     * Decode bytes to a payload.
     *
     * @throws PayloadCodecException if the bytes cannot be decoded
     */
    T decode(byte[] bytes);
}
