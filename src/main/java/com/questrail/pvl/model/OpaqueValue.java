package com.questrail.pvl.model;

import java.util.Objects;

/**
 * A decoded value that has no PVL textual mapping (for example a date/time
 * object produced by a decoder).
 *
 * <p>Encoders reject this variant; it exists so that such values can be
 * carried through a tree and reported precisely when encoding fails.</p>
 */
public record OpaqueValue(Object value) implements LabelValue
{
    public OpaqueValue
    {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString()
    {
        return String.valueOf(value);
    }
}
