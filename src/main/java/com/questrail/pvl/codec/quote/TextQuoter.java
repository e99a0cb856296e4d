package com.questrail.pvl.codec.quote;

import com.questrail.pvl.codec.EncodingRejectedException;

/**
 * TextQuoter
 * -----------------------------------------------------------------------------
 * Quoting collaborator consulted by the value codec for every text value.
 *
 * <p>The encoder treats this as an opaque predicate plus escaper. It never
 * inspects text itself: if {@link #needsQuotes(String)} is false the text is
 * written verbatim, otherwise the result of {@link #quote(String)} is.</p>
 */
public interface TextQuoter
{
    /**
     * Returns true if {@code text} can not be written as a bare symbol under
     * this grammar.
     */
    boolean needsQuotes(String text);

    /**
     * Returns the quoted form of {@code text}, delimiters included.
     *
     * @throws EncodingRejectedException if the text can not be legally quoted
     */
    String quote(String text);
}
