package net.funcore.runtime;

import java.util.function.BiFunction;

public class Curry {
    private Curry() {
        // Not instantiable
    }

    public static <A, B, R> Curried2<A, B, R> curry(BiFunction<A, B, R> function) {
        return a -> b -> function.apply(a, b);
    }

    public static <A, B, C, R> Curried3<A, B, C, R> curry(Function3<A, B, C, R> function) {
        return a -> b -> c -> function.apply(a, b, c);
    }

    public static <A, B, C, D, R> Curried4<A, B, C, D, R> curry(Function4<A, B, C, D, R> function) {
        return a -> b -> c -> d -> function.apply(a, b, c, d);
    }

    /**
     * Curries a function whose arity is only known at runtime. See {@link CurriedN} for how extra or missing
     * arguments are handled.
     */
    public static <R> CurriedN<R> curry(int arity, VariadicFunction<R> function) {
        return CurriedN.create(arity, function);
    }

    public static <A, B, R> BiFunction<A, B, R> uncurry(Curried2<A, B, R> curried) {
        return (a, b) -> curried.apply(a).apply(b);
    }

    public static <A, B, C, R> Function3<A, B, C, R> uncurry(Curried3<A, B, C, R> curried) {
        return (a, b, c) -> curried.apply(a).apply(b).apply(c);
    }
}
