package com.questrail.pvl.codec.quote;

import com.questrail.pvl.codec.EncodingRejectedException;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * GrammarTextQuoter
 * -----------------------------------------------------------------------------
 * {@link TextQuoter} driven by the lexical rules of a PVL-family grammar.
 *
 * <p>Two rule sets are provided:</p>
 * <ul>
 *   <li>{@link #pvl()}: PVL and ISIS rules, double quotes preferred, single quotes
 *       used when the text contains a double quote</li>
 *   <li>{@link #odl()}: ODL and PDS3 rules, ASCII only, double quotes only</li>
 * </ul>
 *
 * <p>Text needs quotes when it is empty, is a reserved word, contains
 * whitespace, control or reserved characters or a comment opener, or starts
 * like a number or date/time would.</p>
 */
public final class GrammarTextQuoter implements TextQuoter
{
    private static final Set<String> RESERVED_WORDS = Set.of(
            "BEGIN_GROUP", "END_GROUP", "BEGIN_OBJECT", "END_OBJECT",
            "GROUP", "OBJECT", "END", "NULL", "TRUE", "FALSE");

    private static final String RESERVED_CHARACTERS = "&<>'\"{},[]=!#()%+;~|";

    private static final GrammarTextQuoter PVL = new GrammarTextQuoter("PVL", false, true);
    private static final GrammarTextQuoter ODL = new GrammarTextQuoter("ODL", true, false);

    private final String grammar;
    private final boolean asciiOnly;
    private final boolean singleQuotesAllowed;

    private GrammarTextQuoter(String grammar, boolean asciiOnly, boolean singleQuotesAllowed)
    {
        this.grammar = grammar;
        this.asciiOnly = asciiOnly;
        this.singleQuotesAllowed = singleQuotesAllowed;
    }

    public static GrammarTextQuoter pvl()
    {
        return PVL;
    }

    public static GrammarTextQuoter odl()
    {
        return ODL;
    }

    @Override
    public boolean needsQuotes(String text)
    {
        Objects.requireNonNull(text, "text");

        if (text.isEmpty()) {
            return true;
        }
        if (RESERVED_WORDS.contains(text.toUpperCase(Locale.ROOT))) {
            return true;
        }
        if (text.contains("/*")) {
            return true;
        }

        // Bare symbols starting like a number (or a date/time) would not read back as text.
        char first = text.charAt(0);
        if (Character.isDigit(first) || first == '+' || first == '-' || first == '.') {
            return true;
        }

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                return true;
            }
            if (RESERVED_CHARACTERS.indexOf(c) >= 0) {
                return true;
            }
            if (asciiOnly && c > 0x7F) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String quote(String text)
    {
        Objects.requireNonNull(text, "text");

        if (asciiOnly) {
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) > 0x7F) {
                    throw new EncodingRejectedException(text,
                            grammar + " text must be ASCII (offset " + i + ")");
                }
            }
        }

        if (text.indexOf('"') < 0) {
            return '"' + text + '"';
        }
        if (singleQuotesAllowed && text.indexOf('\'') < 0) {
            return '\'' + text + '\'';
        }
        throw new EncodingRejectedException(text, singleQuotesAllowed
                ? grammar + " text can not contain both quote characters"
                : grammar + " text can not contain a double quote");
    }

    @Override
    public String toString()
    {
        return "GrammarTextQuoter[" + grammar + "]";
    }
}
