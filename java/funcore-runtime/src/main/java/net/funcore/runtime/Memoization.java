package net.funcore.runtime;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps pure functions with a cache of their results.
 * <p>
 * Only pure functions (same arguments always give the same result, no side effects) may be memoized. Wrapping an
 * impure function is a misuse: later calls will observe the result of the first one.
 * <p>
 * Arguments are compared as a tuple, element by element, using {@code equals} and {@code hashCode}. Nulls are allowed.
 * Arrays are compared by content, using a copy taken at call time. Null results are cached like any other.
 * <p>
 * The cache belongs to the returned wrapper and is never evicted, so it grows with the number of distinct argument
 * tuples seen. Callers may share the wrapper across threads: the first caller for a given key computes the result
 * while concurrent callers with an equal key wait for it. If the function throws, nothing is cached and the exception
 * is rethrown to every waiting caller.
 */
public class Memoization {
    private static final Logger log = LoggerFactory.getLogger(Memoization.class);

    private Memoization() {
        // Not instantiable
    }

    public static <T, R> Function<T, R> memoize(Function<T, R> function) {
        if (function instanceof MemoizedFunction) {
            return function;
        }
        return new MemoizedFunction<T, R>(function);
    }

    public static <A, B, R> BiFunction<A, B, R> memoize(BiFunction<A, B, R> function) {
        Cache<R> cache = new Cache<R>();
        return (a, b) -> cache.get(new ArgumentKey(new Object[] { a, b }), () -> function.apply(a, b));
    }

    public static <A, B, C, R> Function3<A, B, C, R> memoize(Function3<A, B, C, R> function) {
        Cache<R> cache = new Cache<R>();
        return (a, b, c) -> cache.get(new ArgumentKey(new Object[] { a, b, c }), () -> function.apply(a, b, c));
    }

    /**
     * Named apart from {@link #memoize(Function)} because a one-parameter lambda would fit either.
     */
    public static <R> VariadicFunction<R> memoizeVariadic(VariadicFunction<R> function) {
        Cache<R> cache = new Cache<R>();
        return args -> {
            Object[] argsCopy = Objects.requireNonNull(args, "Argument array may not be null").clone();
            return cache.get(new ArgumentKey(argsCopy), () -> function.apply(argsCopy));
        };
    }

    /**
     * Returns a supplier that calls the given one at most once successfully.
     */
    public static <R> Supplier<R> memoize(Supplier<R> supplier) {
        Cache<R> cache = new Cache<R>();
        ArgumentKey key = new ArgumentKey(new Object[0]);
        return () -> cache.get(key, supplier);
    }

    private static final class MemoizedFunction<T, R> implements Function<T, R> {
        private final Cache<R> cache = new Cache<R>();
        private final Function<T, R> function;

        MemoizedFunction(Function<T, R> function) {
            this.function = function;
        }

        @Override
        public R apply(T t) {
            return cache.get(new ArgumentKey(new Object[] { t }), () -> function.apply(t));
        }
    }

    private static final class Cache<R> {
        private final ConcurrentMap<ArgumentKey, FutureTask<R>> results = new ConcurrentHashMap<>();

        R get(ArgumentKey key, Supplier<R> computation) {
            FutureTask<R> task = results.get(key);
            if (task == null) {
                FutureTask<R> newTask = new FutureTask<R>(computation::get);
                task = results.putIfAbsent(key, newTask);
                if (task == null) {
                    log.trace("Cache miss for arguments {}", key);
                    task = newTask;
                    newTask.run();
                }
            }
            try {
                return task.get();
            } catch (ExecutionException e) {
                // Remove only our own entry; a retry may already have replaced it
                if (results.remove(key, task)) {
                    log.debug("Memoized computation failed for arguments {}; discarded its entry", key);
                }
                throw rethrow(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for a memoized computation", e);
            }
        }

        private static RuntimeException rethrow(Throwable cause) {
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            // Only reachable through sneaky-thrown checked exceptions
            throw new IllegalStateException("Memoized computation failed", cause);
        }
    }

    /**
     * The argument tuple of a single call. Its hash is computed eagerly so that a failing {@code hashCode} surfaces
     * before the function is invoked.
     */
    private static final class ArgumentKey {
        private final Object[] args;
        private final int hash;

        ArgumentKey(Object[] args) {
            this.args = deepCopyArrays(args);
            try {
                this.hash = Arrays.deepHashCode(this.args);
            } catch (RuntimeException e) {
                throw new MemoizationKeyException("Could not derive a cache key from the arguments", e);
            }
        }

        private static Object[] deepCopyArrays(Object[] args) {
            Object[] copy = args.clone();
            for (int i = 0; i < copy.length; i++) {
                if (copy[i] instanceof Object[]) {
                    copy[i] = deepCopyArrays((Object[]) copy[i]);
                } else if (copy[i] != null && copy[i].getClass().isArray()) {
                    copy[i] = copyPrimitiveArray(copy[i]);
                }
            }
            return copy;
        }

        private static Object copyPrimitiveArray(Object array) {
            int length = Array.getLength(array);
            Object copy = Array.newInstance(array.getClass().getComponentType(), length);
            System.arraycopy(array, 0, copy, 0, length);
            return copy;
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (obj == null)
                return false;
            if (getClass() != obj.getClass())
                return false;
            ArgumentKey other = (ArgumentKey) obj;
            return hash == other.hash && Arrays.deepEquals(args, other.args);
        }

        @Override
        public String toString() {
            return Arrays.deepToString(args);
        }
    }
}
