package com.questrail.pvl.model;

import java.util.Objects;

/**
 * A scalar paired with a unit label, rendered as {@code value <units>}.
 *
 * <p>The wrapped value may not itself be a {@link UnitsValue} or a
 * {@link LabelMapping}.</p>
 */
public record UnitsValue(LabelValue value, String units) implements LabelValue
{
    public UnitsValue
    {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(units, "units");
        if (units.isBlank()) {
            throw new IllegalArgumentException("Unit label must not be blank");
        }
        if (value instanceof UnitsValue || value instanceof LabelMapping) {
            throw new IllegalArgumentException(
                    "Units can only annotate a scalar, not " + value.getClass().getSimpleName());
        }
    }

    public static UnitsValue of(LabelValue value, String units)
    {
        return new UnitsValue(value, units);
    }

    public static UnitsValue of(long value, String units)
    {
        return new UnitsValue(IntegerValue.of(value), units);
    }

    public static UnitsValue of(double value, String units)
    {
        return new UnitsValue(RealValue.of(value), units);
    }
}
