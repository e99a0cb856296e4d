package com.questrail.pvl.model;

/**
 * A PVL boolean ({@code TRUE} / {@code FALSE}).
 */
public record BooleanValue(boolean value) implements LabelValue
{
    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    public static BooleanValue of(boolean value)
    {
        return value ? TRUE : FALSE;
    }
}
