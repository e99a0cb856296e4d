package com.questrail.pvl.model;

import java.util.Objects;

/**
 * One {@code key = value} statement inside a {@link LabelMapping}.
 */
public record LabelEntry(String key, LabelValue value)
{
    public LabelEntry
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}
