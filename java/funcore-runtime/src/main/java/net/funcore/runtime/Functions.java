package net.funcore.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Composition and partial application.
 * <p>
 * {@code pipe} applies its functions left to right and has one overload per chain length, so a chain whose types
 * don't line up fails to compile. {@link #pipeAll(List)} handles chains of any length when every step has the same
 * input and output type.
 */
public class Functions {
    private Functions() {
        // Not instantiable
    }

    public static <T> Function<T, T> identity() {
        return t -> t;
    }

    public static <T, R> Function<T, R> constant(R value) {
        return ignored -> value;
    }

    public static <A, B, R> BiFunction<B, A, R> flip(BiFunction<A, B, R> function) {
        return (b, a) -> function.apply(a, b);
    }

    /**
     * Returns {@code x -> f(g(x))}; {@code g} is applied first.
     */
    public static <A, B, C> Function<A, C> compose(Function<B, C> f, Function<A, B> g) {
        return a -> f.apply(g.apply(a));
    }

    public static <T> Function<T, T> pipe() {
        return identity();
    }

    public static <A, B> Function<A, B> pipe(Function<A, B> f1) {
        return f1;
    }

    public static <A, B, C> Function<A, C> pipe(Function<A, B> f1, Function<B, C> f2) {
        return compose(f2, f1);
    }

    public static <A, B, C, D> Function<A, D> pipe(Function<A, B> f1, Function<B, C> f2, Function<C, D> f3) {
        return a -> f3.apply(f2.apply(f1.apply(a)));
    }

    public static <A, B, C, D, E> Function<A, E> pipe(Function<A, B> f1, Function<B, C> f2, Function<C, D> f3,
            Function<D, E> f4) {
        return a -> f4.apply(f3.apply(f2.apply(f1.apply(a))));
    }

    public static <A, B, C, D, E, F> Function<A, F> pipe(Function<A, B> f1, Function<B, C> f2, Function<C, D> f3,
            Function<D, E> f4, Function<E, F> f5) {
        return a -> f5.apply(f4.apply(f3.apply(f2.apply(f1.apply(a)))));
    }

    public static <A, B, C, D, E, F, G> Function<A, G> pipe(Function<A, B> f1, Function<B, C> f2, Function<C, D> f3,
            Function<D, E> f4, Function<E, F> f5, Function<F, G> f6) {
        return a -> f6.apply(f5.apply(f4.apply(f3.apply(f2.apply(f1.apply(a))))));
    }

    @SafeVarargs
    public static <T> Function<T, T> pipeAll(Function<T, T>... functions) {
        return pipeAll(Arrays.asList(functions));
    }

    /**
     * Applies the functions in list order. An empty list gives the identity function.
     */
    public static <T> Function<T, T> pipeAll(List<Function<T, T>> functions) {
        List<Function<T, T>> steps = new ArrayList<Function<T, T>>(functions);
        return t -> {
            T value = t;
            for (Function<T, T> step : steps) {
                value = step.apply(value);
            }
            return value;
        };
    }

    public static <A, B, R> Function<B, R> partial(BiFunction<A, B, R> function, A a) {
        return b -> function.apply(a, b);
    }

    public static <A, B, C, R> BiFunction<B, C, R> partial(Function3<A, B, C, R> function, A a) {
        return (b, c) -> function.apply(a, b, c);
    }

    public static <A, B, C, R> Function<C, R> partial(Function3<A, B, C, R> function, A a, B b) {
        return c -> function.apply(a, b, c);
    }

    public static <A, B, C, D, R> Function3<B, C, D, R> partial(Function4<A, B, C, D, R> function, A a) {
        return (b, c, d) -> function.apply(a, b, c, d);
    }

    public static <A, B, C, D, R> BiFunction<C, D, R> partial(Function4<A, B, C, D, R> function, A a, B b) {
        return (c, d) -> function.apply(a, b, c, d);
    }

    public static <A, B, C, D, R> Function<D, R> partial(Function4<A, B, C, D, R> function, A a, B b, C c) {
        return d -> function.apply(a, b, c, d);
    }

    /**
     * Returns a function that calls the given one with the fixed arguments followed by its own arguments. No arity
     * check is made.
     */
    public static <R> VariadicFunction<R> partial(VariadicFunction<R> function, Object... fixedArgs) {
        Object[] fixed = Objects.requireNonNull(fixedArgs, "Fixed argument array may not be null").clone();
        return remainingArgs -> {
            Objects.requireNonNull(remainingArgs, "Argument array may not be null");
            Object[] allArgs = Arrays.copyOf(fixed, fixed.length + remainingArgs.length);
            System.arraycopy(remainingArgs, 0, allArgs, fixed.length, remainingArgs.length);
            return function.apply(allArgs);
        };
    }
}
