package com.questrail.pvl.model;

import java.util.Objects;

/**
 * A PVL text value (symbol or quoted string).
 *
 * <p>Whether the text needs quoting on output is decided by the encoder's
 * quoting collaborator, not by this value.</p>
 */
public record TextValue(String value) implements LabelValue
{
    public TextValue
    {
        Objects.requireNonNull(value, "value");
    }

    public static TextValue of(String value)
    {
        return new TextValue(value);
    }
}
