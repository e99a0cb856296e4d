package com.questrail.pvl.model;

/**
 * A floating-point PVL number.
 *
 * <p>Textual form is whatever {@link Double#toString(double)} yields; exact
 * round-tripping of every real value is not guaranteed.</p>
 */
public record RealValue(double value) implements LabelValue
{
    public static RealValue of(double value)
    {
        return new RealValue(value);
    }
}
