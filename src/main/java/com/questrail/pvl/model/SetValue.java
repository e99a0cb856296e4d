package com.questrail.pvl.model;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An unordered PVL set, rendered as {@code {a, b, c}}.
 *
 * <p>Iteration order is not specified and must not be relied upon.</p>
 */
public record SetValue(Set<LabelValue> elements) implements LabelValue
{
    public SetValue
    {
        elements = Set.copyOf(Objects.requireNonNull(elements, "elements"));
    }

    public static SetValue of(LabelValue... elements)
    {
        return new SetValue(new HashSet<>(Arrays.asList(elements)));
    }
}
