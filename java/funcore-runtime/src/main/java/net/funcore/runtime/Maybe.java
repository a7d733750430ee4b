package net.funcore.runtime;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A value that is either present or absent.
 * <p>
 * Unlike {@link Optional}, a {@code Maybe} is never built implicitly from {@code null}: use {@link #present(Object)}
 * and {@link #absent()}, or {@link #fromNullable(Object)} when crossing over from code that uses nulls. The only
 * subclasses are the two private variants below, so {@link #fold(Supplier, Function)} is exhaustive.
 */
public abstract class Maybe<T> {
    private Maybe() {
        // Only the two variants below
    }

    public static <T> Maybe<T> present(T value) {
        return new Present<T>(Objects.requireNonNull(value, "A present value may not be null; use absent() instead"));
    }

    public static <T> Maybe<T> absent() {
        return new Absent<T>();
    }

    public static <T> Maybe<T> fromNullable(T value) {
        if (value == null) {
            return absent();
        }
        return new Present<T>(value);
    }

    public static <T> Maybe<T> fromOptional(Optional<T> optional) {
        if (optional.isPresent()) {
            return new Present<T>(optional.get());
        }
        return absent();
    }

    public abstract boolean isPresent();

    public final boolean isAbsent() {
        return !isPresent();
    }

    /**
     * Applies exactly one of the two functions, depending on which variant this is.
     */
    public abstract <R> R fold(Supplier<R> onAbsent, Function<T, R> onPresent);

    /**
     * The function must not return null.
     */
    public abstract <U> Maybe<U> map(Function<T, U> function);

    public abstract <U> Maybe<U> andThen(Function<T, Maybe<U>> function);

    public abstract Maybe<T> filter(Predicate<T> predicate);

    public abstract Maybe<T> or(Supplier<Maybe<T>> alternative);

    public abstract T getOrElse(T defaultValue);

    public abstract T getOrElseGet(Supplier<T> defaultSupplier);

    /**
     * @throws EmptyValueAccessException if this is absent
     */
    public abstract T get();

    public abstract void ifPresent(Consumer<T> consumer);

    public final <E> Result<E, T> toResult(E errorIfAbsent) {
        return Result.fromMaybe(this, errorIfAbsent);
    }

    public final Optional<T> toOptional() {
        return fold(Optional::<T>empty, Optional::of);
    }

    private static final class Present<T> extends Maybe<T> {
        private final T value;

        private Present(T value) {
            this.value = value;
        }

        @Override
        public boolean isPresent() {
            return true;
        }

        @Override
        public <R> R fold(Supplier<R> onAbsent, Function<T, R> onPresent) {
            return onPresent.apply(value);
        }

        @Override
        public <U> Maybe<U> map(Function<T, U> function) {
            U result = function.apply(value);
            if (result == null) {
                throw new NullPointerException("Mapping function returned null for " + value);
            }
            return new Present<U>(result);
        }

        @Override
        public <U> Maybe<U> andThen(Function<T, Maybe<U>> function) {
            return Objects.requireNonNull(function.apply(value), "Chained function returned null instead of a Maybe");
        }

        @Override
        public Maybe<T> filter(Predicate<T> predicate) {
            return predicate.test(value) ? this : Maybe.<T>absent();
        }

        @Override
        public Maybe<T> or(Supplier<Maybe<T>> alternative) {
            return this;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<T> defaultSupplier) {
            return value;
        }

        @Override
        public T get() {
            return value;
        }

        @Override
        public void ifPresent(Consumer<T> consumer) {
            consumer.accept(value);
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
            Present<?> other = (Present<?>) obj;
            return value.equals(other.value);
        }

        @Override
        public String toString() {
            return "Present[" + value + "]";
        }
    }

    private static final class Absent<T> extends Maybe<T> {
        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public <R> R fold(Supplier<R> onAbsent, Function<T, R> onPresent) {
            return onAbsent.get();
        }

        @Override
        public <U> Maybe<U> map(Function<T, U> function) {
            return absent();
        }

        @Override
        public <U> Maybe<U> andThen(Function<T, Maybe<U>> function) {
            return absent();
        }

        @Override
        public Maybe<T> filter(Predicate<T> predicate) {
            return this;
        }

        @Override
        public Maybe<T> or(Supplier<Maybe<T>> alternative) {
            return Objects.requireNonNull(alternative.get(), "Alternative supplier returned null instead of a Maybe");
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<T> defaultSupplier) {
            return defaultSupplier.get();
        }

        @Override
        public T get() {
            throw new EmptyValueAccessException("Called get() on an absent value");
        }

        @Override
        public void ifPresent(Consumer<T> consumer) {
            // Nothing to do
        }

        @Override
        public int hashCode() {
            return 0;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Absent;
        }

        @Override
        public String toString() {
            return "Absent";
        }
    }
}
