package net.funcore.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

public class Maybes {
    private Maybes() {
        // Not instantiable
    }

    /**
     * Returns the values of all the elements if every one of them is present, otherwise absent.
     */
    public static <T> Maybe<List<T>> sequence(List<Maybe<T>> maybes) {
        List<T> values = new ArrayList<T>(maybes.size());
        for (Maybe<T> maybe : maybes) {
            if (maybe.isAbsent()) {
                return Maybe.absent();
            }
            values.add(maybe.get());
        }
        return Maybe.present(Collections.unmodifiableList(values));
    }

    /**
     * Like mapping the function over the list and calling {@link #sequence(List)}, but stops calling the function
     * after the first absent result.
     */
    public static <T, U> Maybe<List<U>> traverse(List<T> list, Function<T, Maybe<U>> function) {
        List<U> values = new ArrayList<U>(list.size());
        for (T element : list) {
            Maybe<U> result = function.apply(element);
            if (result.isAbsent()) {
                return Maybe.absent();
            }
            values.add(result.get());
        }
        return Maybe.present(Collections.unmodifiableList(values));
    }

    public static <T> List<T> presentValues(List<Maybe<T>> maybes) {
        List<T> values = new ArrayList<T>();
        for (Maybe<T> maybe : maybes) {
            if (maybe.isPresent()) {
                values.add(maybe.get());
            }
        }
        return values;
    }

    public static <T> Maybe<T> firstPresent(List<Maybe<T>> maybes) {
        for (Maybe<T> maybe : maybes) {
            if (maybe.isPresent()) {
                return maybe;
            }
        }
        return Maybe.absent();
    }
}
