package com.questrail.pvl.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An ordered PVL sequence, rendered as {@code (a, b, c)}.
 */
public record SequenceValue(List<LabelValue> elements) implements LabelValue
{
    public SequenceValue
    {
        elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
    }

    public static SequenceValue of(LabelValue... elements)
    {
        return new SequenceValue(Arrays.asList(elements));
    }

    public static SequenceValue ofIntegers(long... values)
    {
        return new SequenceValue(Arrays.stream(values)
                .mapToObj(IntegerValue::of)
                .map(LabelValue.class::cast)
                .toList());
    }
}
