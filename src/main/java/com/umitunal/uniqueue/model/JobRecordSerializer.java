package com.umitunal.uniqueue.model;

import com.umitunal.uniqueue.core.Job.HistoryEntry;
import com.umitunal.uniqueue.core.JobState;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary serializer for {@link JobRecord} using ByteBuffer.
 *
 * Binary format (strings and byte arrays are length-prefixed, length -1 means null):
 * - format version (1 byte)
 * - id, sequence (8), type, name, payload, priority (4), maxAttempts (4), executionTimeoutMs (8), createdAt (8)
 * - state ordinal (4), attemptCount (4), updatedAt (8), notBefore (8), startedAt (8), completedAt (8)
 * - leaseOwner, leaseExpiresAt (8), leaseEpoch (8), version (8)
 * - cancelRequested (1), result, error, progress (4), progressMessage
 * - history count (4), then per entry: timestamp (8), state ordinal (4), message
 */
public class JobRecordSerializer {
    private static final byte FORMAT_VERSION = 1;

    public byte[] serialize(JobRecord record) {
        byte[] id = bytes(record.getId());
        byte[] type = bytes(record.getType());
        byte[] name = bytes(record.getName());
        byte[] owner = bytes(record.getLeaseOwner());
        byte[] result = bytes(record.getResult());
        byte[] error = bytes(record.getError());
        byte[] progressMessage = bytes(record.getProgressMessage());

        List<HistoryEntry> history = record.getHistory();
        List<byte[]> historyMessages = new ArrayList<>(history.size());
        int historySize = 4;
        for (HistoryEntry entry : history) {
            byte[] message = bytes(entry.getMessage());
            historyMessages.add(message);
            historySize += 8 + 4 + sizeOf(message);
        }

        int totalSize = 1 +
                sizeOf(id) + 8 + sizeOf(type) + sizeOf(name) + sizeOf(record.getPayload()) + 4 + 4 + 8 + 8 +
                4 + 4 + 8 + 8 + 8 + 8 +
                sizeOf(owner) + 8 + 8 + 8 +
                1 + sizeOf(result) + sizeOf(error) + 4 + sizeOf(progressMessage) +
                historySize;

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);

        // Identity and submission data
        put(buffer, id);
        buffer.putLong(record.getSequence());
        put(buffer, type);
        put(buffer, name);
        put(buffer, record.getPayload());
        buffer.putInt(record.getPriority());
        buffer.putInt(record.getMaxAttempts());
        buffer.putLong(record.getExecutionTimeoutMs());
        buffer.putLong(record.getCreatedAt());

        // Lifecycle
        buffer.putInt(record.getState().ordinal());
        buffer.putInt(record.getAttemptCount());
        buffer.putLong(record.getUpdatedAt());
        buffer.putLong(record.getNotBefore());
        buffer.putLong(record.getStartedAt());
        buffer.putLong(record.getCompletedAt());

        // Lease and concurrency control
        put(buffer, owner);
        buffer.putLong(record.getLeaseExpiresAt());
        buffer.putLong(record.getLeaseEpoch());
        buffer.putLong(record.getVersion());

        // Outcome
        buffer.put((byte) (record.isCancelRequested() ? 1 : 0));
        put(buffer, result);
        put(buffer, error);
        buffer.putInt(record.getProgress());
        put(buffer, progressMessage);

        buffer.putInt(history.size());
        for (int i = 0; i < history.size(); i++) {
            buffer.putLong(history.get(i).getTimestamp());
            buffer.putInt(history.get(i).getState().ordinal());
            put(buffer, historyMessages.get(i));
        }

        return buffer.array();
    }

    /**
     * @throws IllegalArgumentException if the bytes are not a serialized job record
     */
    public JobRecord deserialize(byte[] bytes) {
        try {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            byte format = buffer.get();
            if (format != FORMAT_VERSION) {
                throw new IllegalArgumentException("Unsupported job record format: " + format);
            }

            String id = string(buffer);
            long sequence = buffer.getLong();
            String type = string(buffer);
            String name = string(buffer);
            byte[] payload = array(buffer);
            int priority = buffer.getInt();
            int maxAttempts = buffer.getInt();
            long executionTimeoutMs = buffer.getLong();
            long createdAt = buffer.getLong();

            JobRecord record = new JobRecord(id, sequence, type, name, payload, priority, maxAttempts,
                    executionTimeoutMs, createdAt);
            record.setState(state(buffer.getInt()));
            record.setAttemptCount(buffer.getInt());
            record.setUpdatedAt(buffer.getLong());
            record.setNotBefore(buffer.getLong());
            record.setStartedAt(buffer.getLong());
            record.setCompletedAt(buffer.getLong());

            record.setLeaseOwner(string(buffer));
            record.setLeaseExpiresAt(buffer.getLong());
            record.setLeaseEpoch(buffer.getLong());
            record.setVersion(buffer.getLong());

            record.setCancelRequested(buffer.get() == 1);
            record.setResult(string(buffer));
            record.setError(string(buffer));
            record.setProgress(buffer.getInt());
            record.setProgressMessage(string(buffer));

            int historyCount = buffer.getInt();
            List<HistoryEntry> history = new ArrayList<>(historyCount);
            for (int i = 0; i < historyCount; i++) {
                long timestamp = buffer.getLong();
                JobState state = state(buffer.getInt());
                history.add(new HistoryEntry(timestamp, state, string(buffer)));
            }
            record.restoreHistory(history);
            return record;
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Truncated job record", e);
        }
    }

    private static JobState state(int ordinal) {
        JobState[] states = JobState.values();
        if (ordinal < 0 || ordinal >= states.length) {
            throw new IllegalArgumentException("Unknown job state ordinal: " + ordinal);
        }
        return states[ordinal];
    }

    private static byte[] bytes(String value) {
        return value != null ? value.getBytes(UTF_8) : null;
    }

    private static int sizeOf(byte[] value) {
        return 4 + (value != null ? value.length : 0);
    }

    private static void put(ByteBuffer buffer, byte[] value) {
        if (value == null) {
            buffer.putInt(-1);
            return;
        }
        buffer.putInt(value.length);
        buffer.put(value);
    }

    private static byte[] array(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0) {
            return null;
        }
        if (length > buffer.remaining()) {
            throw new BufferUnderflowException();
        }
        byte[] value = new byte[length];
        buffer.get(value);
        return value;
    }

    private static String string(ByteBuffer buffer) {
        byte[] value = array(buffer);
        return value != null ? new String(value, UTF_8) : null;
    }
}
