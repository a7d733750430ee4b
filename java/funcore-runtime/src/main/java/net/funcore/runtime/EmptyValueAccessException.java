package net.funcore.runtime;

import java.util.NoSuchElementException;

/**
 * Thrown when a value is forced out of a container that does not hold one, such as {@link Maybe#get()} on an absent
 * value or {@link Result#unwrap()} on an error. This indicates a programming error, not a recoverable condition.
 */
public class EmptyValueAccessException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    public EmptyValueAccessException(String message) {
        super(message);
    }
}
