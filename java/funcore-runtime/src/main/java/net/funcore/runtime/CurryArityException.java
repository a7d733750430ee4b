package net.funcore.runtime;

public class CurryArityException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public CurryArityException(String message) {
        super(message);
    }
}
