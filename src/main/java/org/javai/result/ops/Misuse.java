package org.javai.result.ops;

import java.time.Instant;
import java.util.Objects;
import org.javai.result.UnwrapException;

/**
 * A misuse failure captured for reporting: an unwrap-style call made on the wrong variant
 * that escaped to the top of a thread.
 *
 * @param operation The misused method (e.g., "unwrap", "unwrapErr")
 * @param message The exception message
 * @param payloadType Class name of the payload the result actually held, or "null"
 * @param threadName The thread on which the exception escaped
 * @param occurredAt When the misuse was reported
 */
public record Misuse(
        String operation,
        String message,
        String payloadType,
        String threadName,
        Instant occurredAt
) {

    public Misuse {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(payloadType, "payloadType must not be null");
        Objects.requireNonNull(threadName, "threadName must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    }

    public static Misuse from(UnwrapException exception, Thread thread) {
        Objects.requireNonNull(exception, "exception must not be null");
        Objects.requireNonNull(thread, "thread must not be null");
        Object payload = exception.payload();
        return new Misuse(
                exception.operation(),
                exception.getMessage(),
                payload == null ? "null" : payload.getClass().getName(),
                thread.getName(),
                Instant.now());
    }
}
