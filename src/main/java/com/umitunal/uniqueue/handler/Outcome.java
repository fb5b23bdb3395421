package com.umitunal.uniqueue.handler;

/**
 * Result of one handler execution.
 */
public final class Outcome {
    private final Kind kind;
    private final String result;
    private final String message;

    private Outcome(Kind kind, String result, String message) {
        this.kind = kind;
        this.result = result;
        this.message = message;
    }

    public Kind getKind() { return kind; }

    /**
     * Result reference of a success, e.g. the output path. May be null.
     */
    public String getResult() { return result; }

    /**
     * Failure reason, null on success.
     */
    public String getMessage() { return message; }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public static Outcome success() {
        return new Outcome(Kind.SUCCESS, null, null);
    }

    public static Outcome success(String resultReference) {
        return new Outcome(Kind.SUCCESS, resultReference, null);
    }

    /**
     * A failure worth retrying, e.g. a dependency was unavailable.
     */
    public static Outcome recoverable(String message) {
        return new Outcome(Kind.RECOVERABLE_FAILURE, null, message);
    }

    /**
     * A failure that will not go away on retry, e.g. a malformed payload.
     */
    public static Outcome unrecoverable(String message) {
        return new Outcome(Kind.UNRECOVERABLE_FAILURE, null, message);
    }

    @Override
    public String toString() {
        return kind == Kind.SUCCESS
                ? "Outcome{SUCCESS, result=" + result + "}"
                : "Outcome{" + kind + ", message=" + message + "}";
    }

    public enum Kind {
        SUCCESS,
        RECOVERABLE_FAILURE,
        UNRECOVERABLE_FAILURE
    }
}
