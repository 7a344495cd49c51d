package com.github.ylgrgyq.ucm;

import com.github.ylgrgyq.ucm.header.HeaderType;

/**
 * Thrown when a header item uses a type which is part of the ucm type table but which
 * this library cannot read or write. The payload size of such an item is unknown, so
 * the rest of the frame can not be recovered after it.
 */
public final class UnsupportedTypeException extends UcmException {
    private static final long serialVersionUID = 2203718960474913206L;

    private final HeaderType type;

    public UnsupportedTypeException(HeaderType type) {
        super("unsupported header type: " + type + " (code: " + type.getCode() + ")");
        this.type = type;
    }

    public UnsupportedTypeException(HeaderType type, String message) {
        super(message);
        this.type = type;
    }

    public HeaderType getType() {
        return type;
    }
}
