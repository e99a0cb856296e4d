package com.questrail.pvl.codec;

/**
 * Base type of every failure raised while encoding a label.
 *
 * <p>Encoding failures are terminal for the current call. Bytes written to the
 * sink before the failure are not retracted.</p>
 */
public abstract class LabelEncodeException extends RuntimeException
{
    protected LabelEncodeException(String message)
    {
        super(message);
    }
}
