package com.questrail.pvl.validate;

/**
 * Result of checking one file against one profile.
 *
 * <p>{@code encoded} is only meaningful when {@code loaded} is true; an
 * unloaded file is never encoded.</p>
 */
public record ProfileOutcome(boolean loaded, boolean encoded)
{
    private static final ProfileOutcome NOT_LOADED = new ProfileOutcome(false, false);
    private static final ProfileOutcome ENCODED = new ProfileOutcome(true, true);
    private static final ProfileOutcome NOT_ENCODED = new ProfileOutcome(true, false);

    public ProfileOutcome
    {
        if (encoded && !loaded) {
            throw new IllegalArgumentException("A label that did not load can not have been encoded");
        }
    }

    public static ProfileOutcome notLoaded()
    {
        return NOT_LOADED;
    }

    public static ProfileOutcome loaded(boolean encoded)
    {
        return encoded ? ENCODED : NOT_ENCODED;
    }
}
