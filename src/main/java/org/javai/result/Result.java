package org.javai.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Represents the result of an operation that may fail.
 * Either {@link Ok} containing a successful value, or {@link Err} containing an error.
 *
 * <p>Expected failures travel as values: combinators such as {@link #map(Function)} and
 * {@link #andThen(Function)} act on the variant they own and pass the other one through
 * untouched. The unwrap family is the escape hatch and throws {@link UnwrapException}
 * when called on the wrong variant.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Result<Integer, String> port = parsePort(raw)
 *     .andThen(p -> p > 0 ? Result.ok(p) : Result.err("port must be positive"))
 *     .mapErr(msg -> "invalid port: " + msg);
 *
 * int effective = port.unwrapOr(8080);
 * }</pre>
 *
 * @param <T> The type of the successful value
 * @param <E> The type of the error
 */
public sealed interface Result<T, E> permits Result.Ok, Result.Err {

    /**
     * A successful result containing a value. The value may be null.
     *
     * @param value the successful value
     */
    record Ok<T, E>(T value) implements Result<T, E> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isErr() {
            return false;
        }

        @Override
        public Optional<T> ok() {
            return Optional.ofNullable(value);
        }

        @Override
        public Optional<E> err() {
            return Optional.empty();
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public E unwrapErr() {
            throw new UnwrapException("unwrapErr", "Called unwrapErr on an Ok value", value, null);
        }

        @Override
        public T expect(String message) {
            return value;
        }

        @Override
        public E expectErr(String message) {
            throw new UnwrapException("expectErr", message + ": " + value, value, null);
        }

        @Override
        public T unwrapOr(T defaultValue) {
            return value;
        }

        @Override
        public T unwrapOrElse(Function<? super E, ? extends T> fallback) {
            return value;
        }

        @Override
        public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <F> Result<T, F> mapErr(Function<? super E, ? extends F> mapper) {
            return new Ok<>(value);
        }

        @Override
        public <U> U mapOr(U defaultValue, Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public <U> Result<U, E> and(Result<U, E> other) {
            return other;
        }

        @Override
        public <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> op) {
            Objects.requireNonNull(op);
            return op.apply(value);
        }

        @Override
        public <F> Result<T, F> or(Result<T, F> other) {
            return retyped();
        }

        @Override
        public <F> Result<T, F> orElse(Function<? super E, ? extends Result<T, F>> op) {
            return retyped();
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> onOk, Function<? super E, ? extends R> onErr) {
            Objects.requireNonNull(onOk);
            return onOk.apply(value);
        }

        @Override
        public Result<T, E> ifOk(Consumer<? super T> action) {
            Objects.requireNonNull(action);
            action.accept(value);
            return this;
        }

        @Override
        public Result<T, E> ifErr(Consumer<? super E> action) {
            return this;
        }

        // An Ok holds no E, so only the static type changes.
        @SuppressWarnings("unchecked")
        private <F> Result<T, F> retyped() {
            return (Result<T, F>) (Result<T, ?>) this;
        }
    }

    /**
     * A failed result containing an error. The error may be null.
     *
     * @param error the error
     */
    record Err<T, E>(E error) implements Result<T, E> {

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isErr() {
            return true;
        }

        @Override
        public Optional<T> ok() {
            return Optional.empty();
        }

        @Override
        public Optional<E> err() {
            return Optional.ofNullable(error);
        }

        @Override
        public T unwrap() {
            throw new UnwrapException("unwrap", UnwrapException.describe(error), error, causeOf(error));
        }

        @Override
        public E unwrapErr() {
            return error;
        }

        @Override
        public T expect(String message) {
            throw new UnwrapException("expect", message + ": " + UnwrapException.describe(error), error, causeOf(error));
        }

        @Override
        public E expectErr(String message) {
            return error;
        }

        @Override
        public T unwrapOr(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T unwrapOrElse(Function<? super E, ? extends T> fallback) {
            Objects.requireNonNull(fallback);
            return fallback.apply(error);
        }

        @Override
        public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
            return new Err<>(error);
        }

        @Override
        public <F> Result<T, F> mapErr(Function<? super E, ? extends F> mapper) {
            Objects.requireNonNull(mapper);
            return new Err<>(mapper.apply(error));
        }

        @Override
        public <U> U mapOr(U defaultValue, Function<? super T, ? extends U> mapper) {
            return defaultValue;
        }

        @Override
        public <U> Result<U, E> and(Result<U, E> other) {
            return retyped();
        }

        @Override
        public <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> op) {
            return retyped();
        }

        @Override
        public <F> Result<T, F> or(Result<T, F> other) {
            return other;
        }

        @Override
        public <F> Result<T, F> orElse(Function<? super E, ? extends Result<T, F>> op) {
            Objects.requireNonNull(op);
            return op.apply(error);
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> onOk, Function<? super E, ? extends R> onErr) {
            Objects.requireNonNull(onErr);
            return onErr.apply(error);
        }

        @Override
        public Result<T, E> ifOk(Consumer<? super T> action) {
            return this;
        }

        @Override
        public Result<T, E> ifErr(Consumer<? super E> action) {
            Objects.requireNonNull(action);
            action.accept(error);
            return this;
        }

        // An Err holds no T, so only the static type changes.
        @SuppressWarnings("unchecked")
        private <U> Result<U, E> retyped() {
            return (Result<U, E>) (Result<?, E>) this;
        }

        private static Throwable causeOf(Object error) {
            return error instanceof Throwable t ? t : null;
        }
    }

    // Query methods
    boolean isOk();
    boolean isErr();

    /**
     * Returns the value of an Ok, or empty for an Err.
     *
     * <p>An Ok holding null also yields empty; use {@link #isOk()} when null is a legitimate value.
     */
    Optional<T> ok();

    /**
     * Returns the error of an Err, or empty for an Ok.
     *
     * <p>An Err holding null also yields empty; use {@link #isErr()} when null is a legitimate error.
     */
    Optional<E> err();

    // Value extraction
    /**
     * Returns the value of an Ok.
     *
     * @throws UnwrapException on an Err, with the error's description as its message
     */
    T unwrap();

    /**
     * Returns the error of an Err.
     *
     * @throws UnwrapException on an Ok
     */
    E unwrapErr();

    /**
     * Like {@link #unwrap()}, but prefixes the failure message with {@code message}.
     */
    T expect(String message);

    /**
     * Like {@link #unwrapErr()}, but prefixes the failure message with {@code message}.
     */
    E expectErr(String message);

    T unwrapOr(T defaultValue);
    T unwrapOrElse(Function<? super E, ? extends T> fallback);

    // Transformations
    <U> Result<U, E> map(Function<? super T, ? extends U> mapper);
    <F> Result<T, F> mapErr(Function<? super E, ? extends F> mapper);
    <U> U mapOr(U defaultValue, Function<? super T, ? extends U> mapper);

    // Sequencing
    /**
     * Returns {@code other} if this is an Ok, otherwise this Err unchanged.
     */
    <U> Result<U, E> and(Result<U, E> other);

    /**
     * Applies {@code op} to the value of an Ok and returns its result as is.
     * An Err is returned unchanged and {@code op} is never called.
     */
    <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> op);

    <F> Result<T, F> or(Result<T, F> other);
    <F> Result<T, F> orElse(Function<? super E, ? extends Result<T, F>> op);

    /**
     * Folds both variants into a single value.
     */
    <R> R match(Function<? super T, ? extends R> onOk, Function<? super E, ? extends R> onErr);

    // Side effects
    Result<T, E> ifOk(Consumer<? super T> action);
    Result<T, E> ifErr(Consumer<? super E> action);

    // Static factories
    static <T, E> Result<T, E> ok(T value) {
        return new Ok<>(value);
    }

    static <T, E> Result<T, E> err(E error) {
        return new Err<>(error);
    }
}
