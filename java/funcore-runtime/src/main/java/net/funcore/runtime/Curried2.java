package net.funcore.runtime;

import java.util.function.Function;

/**
 * A curried two-argument function. Arguments may be supplied one at a time or both at once.
 */
@FunctionalInterface
public interface Curried2<A, B, R> extends Function<A, Function<B, R>> {
    default R apply(A a, B b) {
        return apply(a).apply(b);
    }
}
