package net.funcore.runtime;

@FunctionalInterface
public interface Function3<A, B, C, R> {
    R apply(A a, B b, C c);

    default Curried3<A, B, C, R> curried() {
        return Curry.curry(this);
    }
}
