package com.questrail.pvl.validate;

import com.questrail.pvl.codec.LabelEncoder;

import java.util.Objects;

/**
 * A named pairing of a loader with an encoder, e.g. {@code PDS3} or {@code ISIS}.
 */
public record LabelProfile(String name, LabelLoader loader, LabelEncoder encoder)
{
    public LabelProfile
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(loader, "loader");
        Objects.requireNonNull(encoder, "encoder");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Profile name must not be blank");
        }
    }
}
