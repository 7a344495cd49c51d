package com.github.ylgrgyq.ucm;

/**
 * Thrown when the bytes being decoded are not a well formed ucm frame: a bad magic number,
 * an unknown header type code, an unknown pixel encoding, a negative count or a stream which
 * ends before the frame does.
 */
public final class FormatException extends UcmException {
    private static final long serialVersionUID = -6120453319840257714L;

    private final long offset;

    public FormatException(String message) {
        this(message, -1L);
    }

    public FormatException(String message, long offset) {
        super(offset >= 0 ? message + " (at byte offset: " + offset + ")" : message);
        this.offset = offset;
    }

    public FormatException(String message, long offset, Throwable cause) {
        super(offset >= 0 ? message + " (at byte offset: " + offset + ")" : message, cause);
        this.offset = offset;
    }

    /**
     * Returns the offset in bytes from the start of the frame at which the error was
     * detected, or -1 if it is unknown.
     *
     * @return byte offset of the error or -1
     */
    public long getOffset() {
        return offset;
    }
}
