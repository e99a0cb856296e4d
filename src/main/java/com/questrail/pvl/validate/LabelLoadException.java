package com.questrail.pvl.validate;

/**
 * Indicates that label text could not be loaded into a tree by a
 * {@link LabelLoader} (lexing, parsing or decoding failure).
 */
public final class LabelLoadException extends RuntimeException
{
    public LabelLoadException(String message) {
        super(message);
    }

    public LabelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
