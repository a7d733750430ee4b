package net.funcore.runtime;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a successful value ({@code Ok}) or an error ({@code Err}). Neither payload may be null.
 * <p>
 * There is no implicit conversion from {@link Maybe}; use {@link #fromMaybe(Maybe, Object)} so that the reason for a
 * missing value is stated explicitly.
 */
public abstract class Result<E, T> {
    private Result() {
        // Only the two variants below
    }

    public static <E, T> Result<E, T> ok(T value) {
        return new Ok<E, T>(Objects.requireNonNull(value, "An ok value may not be null"));
    }

    public static <E, T> Result<E, T> err(E error) {
        return new Err<E, T>(Objects.requireNonNull(error, "An error may not be null"));
    }

    public static <E, T> Result<E, T> fromMaybe(Maybe<T> maybe, E errorIfAbsent) {
        if (maybe.isPresent()) {
            return ok(maybe.get());
        }
        return err(errorIfAbsent);
    }

    public abstract boolean isOk();

    public final boolean isErr() {
        return !isOk();
    }

    /**
     * Applies exactly one of the two functions, depending on which variant this is.
     */
    public abstract <R> R fold(Function<E, R> onErr, Function<T, R> onOk);

    public abstract <U> Result<E, U> map(Function<T, U> function);

    public abstract <F> Result<F, T> mapErr(Function<E, F> function);

    public abstract <U> Result<E, U> andThen(Function<T, Result<E, U>> function);

    public abstract T unwrapOr(T defaultValue);

    public abstract T unwrapOrElse(Function<E, T> function);

    /**
     * @throws EmptyValueAccessException if this is an error
     */
    public abstract T unwrap();

    /**
     * @throws EmptyValueAccessException if this is ok
     */
    public abstract E unwrapErr();

    public final Maybe<T> toMaybe() {
        return fold(e -> Maybe.<T>absent(), Maybe::present);
    }

    public final Maybe<E> errorMaybe() {
        return fold(Maybe::present, t -> Maybe.<E>absent());
    }

    private static final class Ok<E, T> extends Result<E, T> {
        private final T value;

        private Ok(T value) {
            this.value = value;
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public <R> R fold(Function<E, R> onErr, Function<T, R> onOk) {
            return onOk.apply(value);
        }

        @Override
        public <U> Result<E, U> map(Function<T, U> function) {
            return ok(function.apply(value));
        }

        @Override
        public <F> Result<F, T> mapErr(Function<E, F> function) {
            return new Ok<F, T>(value);
        }

        @Override
        public <U> Result<E, U> andThen(Function<T, Result<E, U>> function) {
            return Objects.requireNonNull(function.apply(value), "Chained function returned null instead of a Result");
        }

        @Override
        public T unwrapOr(T defaultValue) {
            return value;
        }

        @Override
        public T unwrapOrElse(Function<E, T> function) {
            return value;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public E unwrapErr() {
            throw new EmptyValueAccessException("Called unwrapErr() on an ok result: " + value);
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            return prime + value.hashCode();
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (obj == null)
                return false;
            if (getClass() != obj.getClass())
                return false;
            Ok<?, ?> other = (Ok<?, ?>) obj;
            return value.equals(other.value);
        }

        @Override
        public String toString() {
            return "Ok[" + value + "]";
        }
    }

    private static final class Err<E, T> extends Result<E, T> {
        private final E error;

        private Err(E error) {
            this.error = error;
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public <R> R fold(Function<E, R> onErr, Function<T, R> onOk) {
            return onErr.apply(error);
        }

        @Override
        public <U> Result<E, U> map(Function<T, U> function) {
            return new Err<E, U>(error);
        }

        @Override
        public <F> Result<F, T> mapErr(Function<E, F> function) {
            return err(function.apply(error));
        }

        @Override
        public <U> Result<E, U> andThen(Function<T, Result<E, U>> function) {
            return new Err<E, U>(error);
        }

        @Override
        public T unwrapOr(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T unwrapOrElse(Function<E, T> function) {
            return function.apply(error);
        }

        @Override
        public T unwrap() {
            throw new EmptyValueAccessException("Called unwrap() on an error result: " + error);
        }

        @Override
        public E unwrapErr() {
            return error;
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            return 2 * prime + error.hashCode();
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (obj == null)
                return false;
            if (getClass() != obj.getClass())
                return false;
            Err<?, ?> other = (Err<?, ?>) obj;
            return error.equals(other.error);
        }

        @Override
        public String toString() {
            return "Err[" + error + "]";
        }
    }
}
