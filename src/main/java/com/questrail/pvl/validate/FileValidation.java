package com.questrail.pvl.validate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcomes for one file, keyed by profile name in profile order.
 */
public record FileValidation(String file, Map<String, ProfileOutcome> outcomes)
{
    public FileValidation
    {
        Objects.requireNonNull(file, "file");
        outcomes = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(outcomes, "outcomes")));
    }

    /**
     * @throws IllegalArgumentException if no outcome was recorded for {@code profile}
     */
    public ProfileOutcome outcome(String profile)
    {
        ProfileOutcome outcome = outcomes.get(profile);
        if (outcome == null) {
            throw new IllegalArgumentException("No outcome for profile: " + profile);
        }
        return outcome;
    }
}
