package net.funcore.runtime;

@FunctionalInterface
public interface Function4<A, B, C, D, R> {
    R apply(A a, B b, C c, D d);

    default Curried4<A, B, C, D, R> curried() {
        return Curry.curry(this);
    }
}
