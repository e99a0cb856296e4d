package com.questrail.pvl.validate;

import com.questrail.pvl.model.LabelMapping;

/**
 * Port for the parser/decoder half of a dialect profile.
 *
 * <p>Implementations live outside this library; the validator only needs to
 * know whether loading succeeded.</p>
 */
@FunctionalInterface
public interface LabelLoader
{
    /**
     * @throws LabelLoadException if {@code text} is not a valid label for this loader
     */
    LabelMapping load(String text);
}
