package com.questrail.pvl.validate;

import com.questrail.pvl.codec.LabelEncodeException;
import com.questrail.pvl.model.LabelMapping;
import com.questrail.pvl.validate.observability.NullValidationObservabilitySink;
import com.questrail.pvl.validate.observability.ValidationFailureEvent;
import com.questrail.pvl.validate.observability.ValidationObservabilitySink;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * LabelValidator
 * =============================================================================
 * Checks which dialect profiles can load a label and then encode it again.
 *
 * <h2>Per profile</h2>
 * <ol>
 *   <li>Load the text with the profile's {@link LabelLoader}. A
 *       {@link LabelLoadException} records "not loaded" and skips step 2.</li>
 *   <li>Encode the loaded tree with the profile's encoder into a private
 *       buffer. A {@link LabelEncodeException} records "not encoded".</li>
 * </ol>
 *
 * <p>Failures are reported to the {@link ValidationObservabilitySink} and never
 * abort the run: one bad profile or file does not hide the others. Any other
 * exception is a defect in a collaborator and propagates.</p>
 */
public final class LabelValidator
{
    private final List<LabelProfile> profiles;
    private final ValidationObservabilitySink observability;
    private final Clock clock;

    public LabelValidator(List<LabelProfile> profiles)
    {
        this(profiles, NullValidationObservabilitySink.INSTANCE, Clock.systemUTC());
    }

    public LabelValidator(List<LabelProfile> profiles, ValidationObservabilitySink observability)
    {
        this(profiles, observability, Clock.systemUTC());
    }

    public LabelValidator(List<LabelProfile> profiles,
                          ValidationObservabilitySink observability,
                          Clock clock)
    {
        this.profiles = List.copyOf(Objects.requireNonNull(profiles, "profiles"));
        this.observability = Objects.requireNonNull(observability, "observability");
        this.clock = Objects.requireNonNull(clock, "clock");

        if (this.profiles.isEmpty()) {
            throw new IllegalArgumentException("At least one profile required");
        }
        long distinct = this.profiles.stream().map(LabelProfile::name).distinct().count();
        if (distinct != this.profiles.size()) {
            throw new IllegalArgumentException("Profile names must be unique");
        }
    }

    /**
     * Returns the profile names in the order results are reported.
     */
    public List<String> profileNames()
    {
        return profiles.stream().map(LabelProfile::name).toList();
    }

    /**
     * Validates one file's text against every profile.
     *
     * @param file name used in reports and failure events
     * @param text label text
     */
    public FileValidation validate(String file, String text)
    {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(text, "text");

        Map<String, ProfileOutcome> outcomes = new LinkedHashMap<>();
        for (LabelProfile profile : profiles) {
            outcomes.put(profile.name(), check(profile, file, text));
        }
        return new FileValidation(file, outcomes);
    }

    private ProfileOutcome check(LabelProfile profile, String file, String text)
    {
        final LabelMapping label;
        try {
            label = profile.loader().load(text);
        }
        catch (LabelLoadException e) {
            observability.onLoadFailure(
                    new ValidationFailureEvent(clock.instant(), profile.name(), file, e));
            return ProfileOutcome.notLoaded();
        }

        try {
            profile.encoder().encodeToBytes(label);
            return ProfileOutcome.loaded(true);
        }
        catch (LabelEncodeException e) {
            observability.onEncodeFailure(
                    new ValidationFailureEvent(clock.instant(), profile.name(), file, e));
            return ProfileOutcome.loaded(false);
        }
    }
}
