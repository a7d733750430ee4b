package net.funcore.runtime;

/**
 * A function whose arity is only known at runtime. Used where the argument count can't be expressed in the type, as
 * with {@link Curry#curry(int, VariadicFunction)} and {@link Functions#partial(VariadicFunction, Object...)}.
 */
@FunctionalInterface
public interface VariadicFunction<R> {
    R apply(Object... args);
}
