package com.github.ylgrgyq.ucm;

/**
 * A {@link UcmException} encapsulates an error raised while reading or writing a ucm frame.
 * Underlying I/O failures are not wrapped in it, they are thrown as {@link java.io.IOException}
 * unchanged.
 */
public class UcmException extends Exception {
    private static final long serialVersionUID = 4723116829310925471L;

    public UcmException() {
        super();
    }

    public UcmException(String message) {
        super(message);
    }

    public UcmException(Throwable throwable) {
        super(throwable);
    }

    public UcmException(String message, Throwable throwable) {
        super(message, throwable);
    }
}
