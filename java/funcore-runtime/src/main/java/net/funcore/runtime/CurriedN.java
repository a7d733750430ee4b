package net.funcore.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A curried function whose arity is checked at runtime. Each call to {@link #apply(Object...)} returns a new instance
 * holding the arguments supplied so far; once all of them are present, {@link #get()} invokes the underlying function.
 * <p>
 * Supplying more arguments than the declared arity is rejected with a {@link CurryArityException}; extra arguments
 * are never passed through.
 */
public final class CurriedN<R> {
    private final int arity;
    private final List<Object> supplied;
    private final VariadicFunction<R> function;

    private CurriedN(int arity, List<Object> supplied, VariadicFunction<R> function) {
        this.arity = arity;
        this.supplied = supplied;
        this.function = function;
    }

    static <R> CurriedN<R> create(int arity, VariadicFunction<R> function) {
        if (arity < 0) {
            throw new CurryArityException("Arity may not be negative, but was " + arity);
        }
        return new CurriedN<R>(arity, Collections.emptyList(), function);
    }

    /**
     * Returns a new instance with the arguments appended. The function is never invoked here, even when this call
     * supplies the last argument; use {@link #get()} or {@link #result()} on the saturated instance.
     *
     * @throws CurryArityException if the total number of arguments would exceed the arity
     */
    public CurriedN<R> apply(Object... args) {
        Objects.requireNonNull(args, "Argument array may not be null; pass (Object) null for a single null argument");
        int total = supplied.size() + args.length;
        if (total > arity) {
            throw new CurryArityException("Expected " + arity + " arguments but received " + total);
        }
        List<Object> newSupplied = new ArrayList<Object>(total);
        newSupplied.addAll(supplied);
        newSupplied.addAll(Arrays.asList(args));
        return new CurriedN<R>(arity, Collections.unmodifiableList(newSupplied), function);
    }

    public int arity() {
        return arity;
    }

    public int remaining() {
        return arity - supplied.size();
    }

    public boolean isSaturated() {
        return supplied.size() == arity;
    }

    /**
     * Invokes the function with the supplied arguments.
     *
     * @throws CurryArityException if fewer arguments than the arity have been supplied
     */
    public R get() {
        if (!isSaturated()) {
            throw new CurryArityException("Expected " + arity + " arguments but only " + supplied.size()
                    + " have been supplied");
        }
        return function.apply(supplied.toArray());
    }

    /**
     * Present with the function's result once saturated, absent otherwise. The function must not return null.
     */
    public Maybe<R> result() {
        if (!isSaturated()) {
            return Maybe.absent();
        }
        return Maybe.present(get());
    }

    @Override
    public String toString() {
        return "CurriedN [arity=" + arity + ", supplied=" + supplied + "]";
    }
}
