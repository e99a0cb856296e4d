package com.questrail.pvl.model;

/**
 * An integral PVL number.
 */
public record IntegerValue(long value) implements LabelValue
{
    public static IntegerValue of(long value)
    {
        return new IntegerValue(value);
    }
}
