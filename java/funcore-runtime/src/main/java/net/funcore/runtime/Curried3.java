package net.funcore.runtime;

import java.util.function.Function;

/**
 * A curried three-argument function. Any prefix of the arguments may be supplied in a single call.
 */
@FunctionalInterface
public interface Curried3<A, B, C, R> extends Function<A, Curried2<B, C, R>> {
    default Function<C, R> apply(A a, B b) {
        return apply(a).apply(b);
    }

    default R apply(A a, B b, C c) {
        return apply(a).apply(b, c);
    }
}
