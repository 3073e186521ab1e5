package com.postbox;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome reported by an actor body: the value it returned, or the exception it threw.
 * Sealed to ensure exhaustive matching.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Successful result containing the value returned by the body.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public Optional<Throwable> failureCause() {
            return Optional.empty();
        }
    }

    /**
     * Failed result containing the exception thrown by the body.
     */
    record Failure<T>(Throwable error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            if (error instanceof RuntimeException) {
                throw (RuntimeException) error;
            }
            throw new ActorException("Actor body failed", error);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public Optional<Throwable> failureCause() {
            return Optional.of(error);
        }
    }

    boolean isSuccess();
    T getOrThrow();
    T getOrElse(T defaultValue);
    Optional<Throwable> failureCause();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Returns whether this is a failure whose cause is an instance of the given type.
     */
    default boolean failedWith(Class<? extends Throwable> type) {
        return failureCause().filter(type::isInstance).isPresent();
    }

    default <U> Result<U> map(Function<T, U> fn) {
        if (this instanceof Success<T> success) {
            try {
                return new Success<>(fn.apply(success.value()));
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    default void ifSuccess(Consumer<T> consumer) {
        if (this instanceof Success<T> success) {
            consumer.accept(success.value());
        }
    }

    default void ifFailure(Consumer<Throwable> consumer) {
        if (this instanceof Failure<T> failure) {
            consumer.accept(failure.error());
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error);
    }
}
