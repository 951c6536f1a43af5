package com.questrail.poolheat.api;

import java.util.Objects;

/**
 * A cloud call failed below the semantic layer.
 *
 * <ul>
 *   <li>{@link Kind#RETRYABLE}: timeouts, connection failures and 5xx responses.
 *       The same request may succeed later.</li>
 *   <li>{@link Kind#FATAL}: malformed or unexpected responses. Repeating the
 *       request will not help.</li>
 * </ul>
 *
 * The client layer never retries these; callers choose their own policy.
 */
public final class TransportException extends HeatPumpException
{
    public enum Kind {
        RETRYABLE,
        FATAL
    }

    private final Kind kind;

    public TransportException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public TransportException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static TransportException retryable(String message, Throwable cause) {
        return new TransportException(Kind.RETRYABLE, message, cause);
    }

    public static TransportException fatal(String message, Throwable cause) {
        return new TransportException(Kind.FATAL, message, cause);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE;
    }
}
