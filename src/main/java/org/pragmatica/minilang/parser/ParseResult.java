package org.pragmatica.minilang.parser;

import org.pragmatica.minilang.error.SyntaxError;
import org.pragmatica.minilang.error.SyntaxException;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a parsing rule: either the completed node or the syntax error that aborted it.
 * A rule that fails never hands out a partially built node.
 */
public sealed interface ParseResult<T> {

    static <T> ParseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseResult<T> failure(SyntaxError error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    <U> ParseResult<U> map(Function<? super T, ? extends U> mapper);

    <U> ParseResult<U> flatMap(Function<? super T, ParseResult<U>> mapper);

    <U> U fold(Function<? super SyntaxError, ? extends U> onFailure, Function<? super T, ? extends U> onSuccess);

    /**
     * Value of a successful result.
     *
     * @throws SyntaxException if this is a failure
     */
    T unwrap();

    /**
     * Error of a failed result.
     *
     * @throws IllegalStateException if this is a success
     */
    SyntaxError error();

    /**
     * Re-type a failure; the error is carried over unchanged.
     *
     * @throws IllegalStateException if this is a success
     */
    <U> ParseResult<U> propagate();

    default ParseResult<T> onFailure(Consumer<? super SyntaxError> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.error());
        }
        return this;
    }

    default ParseResult<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    /**
     * Rule completed; holds the node it built.
     */
    record Success<T>(T value) implements ParseResult<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <U> ParseResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> ParseResult<U> flatMap(Function<? super T, ParseResult<U>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public <U> U fold(Function<? super SyntaxError, ? extends U> onFailure,
                          Function<? super T, ? extends U> onSuccess) {
            return onSuccess.apply(value);
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public SyntaxError error() {
            throw new IllegalStateException("Successful result has no error");
        }

        @Override
        public <U> ParseResult<U> propagate() {
            throw new IllegalStateException("Only a failure can be propagated");
        }
    }

    /**
     * Rule aborted with a syntax error.
     */
    record Failure<T>(SyntaxError error) implements ParseResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <U> ParseResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(error);
        }

        @Override
        public <U> ParseResult<U> flatMap(Function<? super T, ParseResult<U>> mapper) {
            return new Failure<>(error);
        }

        @Override
        public <U> U fold(Function<? super SyntaxError, ? extends U> onFailure,
                          Function<? super T, ? extends U> onSuccess) {
            return onFailure.apply(error);
        }

        @Override
        public T unwrap() {
            throw new SyntaxException(error);
        }

        @Override
        public <U> ParseResult<U> propagate() {
            return new Failure<>(error);
        }
    }
}
