package net.funcore.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

public class Results {
    private Results() {
        // Not instantiable
    }

    /**
     * Collects the values of all the results if they are all ok; otherwise returns the first error in list order.
     */
    public static <E, T> Result<E, List<T>> sequence(List<Result<E, T>> results) {
        List<T> values = new ArrayList<T>(results.size());
        for (Result<E, T> result : results) {
            if (result.isErr()) {
                return Result.err(result.unwrapErr());
            }
            values.add(result.unwrap());
        }
        return Result.ok(Collections.unmodifiableList(values));
    }

    /**
     * Applies the function to each element in order, stopping at the first error.
     */
    public static <E, T, U> Result<E, List<U>> traverse(List<T> list, Function<T, Result<E, U>> function) {
        List<U> values = new ArrayList<U>(list.size());
        for (T element : list) {
            Result<E, U> result = function.apply(element);
            if (result.isErr()) {
                return Result.err(result.unwrapErr());
            }
            values.add(result.unwrap());
        }
        return Result.ok(Collections.unmodifiableList(values));
    }
}
