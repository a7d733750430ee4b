package net.funcore.runtime;

/**
 * Thrown when the cache key for a memoized call cannot be derived from its arguments.
 */
public class MemoizationKeyException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public MemoizationKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
