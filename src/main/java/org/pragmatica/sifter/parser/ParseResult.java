package org.pragmatica.sifter.parser;

import org.pragmatica.sifter.error.CommandError;
import org.pragmatica.sifter.error.CommandException;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Result of a parsing step - either success with a value or failure with an error.
 */
public sealed interface ParseResult<T> {

    static <T> ParseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseResult<T> failure(CommandError error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    <R> ParseResult<R> map(Function<? super T, ? extends R> mapper);

    <R> ParseResult<R> flatMap(Function<? super T, ParseResult<R>> mapper);

    <R> R fold(Function<? super CommandError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    /**
     * Error of a failed result, empty for a successful one.
     */
    Optional<CommandError> error();

    /**
     * Value of a successful result.
     *
     * @throws CommandException if this result is a failure
     */
    T unwrap();

    default ParseResult<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default ParseResult<T> onFailure(Consumer<? super CommandError> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.cause());
        }
        return this;
    }

    record Success<T>(T value) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <R> ParseResult<R> flatMap(Function<? super T, ParseResult<R>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public <R> R fold(Function<? super CommandError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }

        @Override
        public Optional<CommandError> error() {
            return Optional.empty();
        }

        @Override
        public T unwrap() {
            return value;
        }
    }

    record Failure<T>(CommandError cause) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(cause);
        }

        @Override
        public <R> ParseResult<R> flatMap(Function<? super T, ParseResult<R>> mapper) {
            return new Failure<>(cause);
        }

        @Override
        public <R> R fold(Function<? super CommandError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }

        @Override
        public Optional<CommandError> error() {
            return Optional.of(cause);
        }

        @Override
        public T unwrap() {
            throw new CommandException(cause);
        }
    }
}
