package com.questrail.pvl.codec;

/**
 * Indicates that the quoting collaborator refused to quote a text value
 * under the active dialect's grammar.
 */
public final class EncodingRejectedException extends LabelEncodeException
{
    private final String text;

    public EncodingRejectedException(String text, String reason)
    {
        super("Cannot quote '" + text + "': " + reason);
        this.text = text;
    }

    public String text()
    {
        return text;
    }
}
