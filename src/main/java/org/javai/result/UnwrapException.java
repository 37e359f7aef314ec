package org.javai.result;

/**
 * Thrown when an unwrap-style method is called on the variant that does not hold the requested payload,
 * for example {@link Result#unwrap()} on an Err or {@link Result#unwrapErr()} on an Ok.
 * This is an unchecked exception because it indicates misuse of the API—
 * the caller should have checked {@link Result#isOk()} first or used a combinator.
 */
public class UnwrapException extends RuntimeException {

    private final String operation;
    private final transient Object payload;

    public UnwrapException(String operation, String message, Object payload, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.payload = payload;
    }

    /**
     * The name of the method that was misused, e.g. {@code "unwrap"}.
     */
    public String operation() {
        return operation;
    }

    /**
     * The payload the result actually held: the error for {@code unwrap}, the value for {@code unwrapErr}.
     */
    public Object payload() {
        return payload;
    }

    /**
     * Produces a human-readable description of an error value.
     */
    static String describe(Object error) {
        if (error instanceof Throwable t) {
            return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
        }
        return String.valueOf(error);
    }
}
