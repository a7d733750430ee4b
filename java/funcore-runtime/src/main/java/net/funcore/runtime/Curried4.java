package net.funcore.runtime;

import java.util.function.Function;

@FunctionalInterface
public interface Curried4<A, B, C, D, R> extends Function<A, Curried3<B, C, D, R>> {
    default Curried2<C, D, R> apply(A a, B b) {
        return apply(a).apply(b);
    }

    default Function<D, R> apply(A a, B b, C c) {
        return apply(a).apply(b, c);
    }

    default R apply(A a, B b, C c, D d) {
        return apply(a).apply(b, c, d);
    }
}
