package org.finos.legend.indent.parse;

import java.util.function.Function;

/**
 * Three-valued parser outcome: success or failure, each tagged with {@link Progress}.
 *
 * @param <T> value produced on success
 * @param <E> context error produced on failure
 */
public sealed interface ParseResult<T, E> permits ParseResult.Ok, ParseResult.Err {

    Progress progress();

    /** Residual state on success, state at failure otherwise. */
    State state();

    boolean isOk();

    /** @throws IllegalStateException on a failure */
    T value();

    /** @throws IllegalStateException on a success */
    E error();

    static <T, E> ParseResult<T, E> ok(Progress progress, T value, State state) {
        return new Ok<>(progress, value, state);
    }

    static <T, E> ParseResult<T, E> err(Progress progress, E error, State state) {
        return new Err<>(progress, error, state);
    }

    /**
     * Retypes a failure so it can be returned from a parser of another value type.
     */
    <U> ParseResult<U, E> castErr();

    <U> ParseResult<U, E> map(Function<? super T, ? extends U> mapper);

    <F> ParseResult<T, F> mapError(Function<? super E, ? extends F> mapper);

    ParseResult<T, E> withProgress(Progress progress);

    record Ok<T, E>(Progress progress, T value, State state) implements ParseResult<T, E> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public E error() {
            throw new IllegalStateException("No error on a successful parse");
        }

        @Override
        public <U> ParseResult<U, E> castErr() {
            throw new IllegalStateException("Cannot cast a successful parse to a failure");
        }

        @Override
        public <U> ParseResult<U, E> map(Function<? super T, ? extends U> mapper) {
            return new Ok<>(progress, mapper.apply(value), state);
        }

        @Override
        public <F> ParseResult<T, F> mapError(Function<? super E, ? extends F> mapper) {
            return new Ok<>(progress, value, state);
        }

        @Override
        public ParseResult<T, E> withProgress(Progress newProgress) {
            return new Ok<>(newProgress, value, state);
        }
    }

    record Err<T, E>(Progress progress, E error, State state) implements ParseResult<T, E> {

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("No value on a failed parse: " + error);
        }

        @Override
        public <U> ParseResult<U, E> castErr() {
            return new Err<>(progress, error, state);
        }

        @Override
        public <U> ParseResult<U, E> map(Function<? super T, ? extends U> mapper) {
            return new Err<>(progress, error, state);
        }

        @Override
        public <F> ParseResult<T, F> mapError(Function<? super E, ? extends F> mapper) {
            return new Err<>(progress, mapper.apply(error), state);
        }

        @Override
        public ParseResult<T, E> withProgress(Progress newProgress) {
            return new Err<>(newProgress, error, state);
        }
    }
}
