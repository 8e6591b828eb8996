package org.persoftware.seta.lang;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a computation - either a value or a {@link Cause} describing why there is none.
 */
public sealed interface Result<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Cause cause) {
        return new Failure<>(cause);
    }

    /**
     * Value of a successful result.
     *
     * @throws IllegalStateException if this result is a failure
     */
    T unwrap();

    /**
     * Cause of a failed result.
     *
     * @throws IllegalStateException if this result is a success
     */
    Cause cause();

    <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return fold(Result::failure, value -> success(mapper.apply(value)));
    }

    default <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        return fold(Result::failure, mapper::apply);
    }

    default Result<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default Result<T> onFailure(Consumer<? super Cause> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.cause());
        }
        return this;
    }

    record Success<T>(T value) implements Result<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public Cause cause() {
            throw new IllegalStateException("Successful result has no cause");
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(Cause cause) implements Result<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Unwrap of failed result: " + cause.message());
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }
    }
}
