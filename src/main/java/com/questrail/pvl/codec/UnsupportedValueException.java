package com.questrail.pvl.codec;

import com.questrail.pvl.model.LabelValue;

/**
 * Indicates that a value has no textual mapping in the label grammar.
 *
 * This typically reflects:
 * <ul>
 *   <li>An {@link com.questrail.pvl.model.OpaqueValue} left in the tree by a decoder</li>
 *   <li>A nested mapping placed inside a sequence, set or units wrapper</li>
 * </ul>
 */
public final class UnsupportedValueException extends LabelEncodeException
{
    private final String representation;

    public UnsupportedValueException(LabelValue value)
    {
        this(String.valueOf(value));
    }

    public UnsupportedValueException(String representation)
    {
        super(representation + " is not serializable");
        this.representation = representation;
    }

    /**
     * Textual representation of the offending value.
     */
    public String representation()
    {
        return representation;
    }
}
