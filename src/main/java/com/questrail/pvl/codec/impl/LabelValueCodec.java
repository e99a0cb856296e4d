package com.questrail.pvl.codec.impl;

import com.questrail.pvl.codec.UnsupportedValueException;
import com.questrail.pvl.codec.quote.TextQuoter;
import com.questrail.pvl.model.BooleanValue;
import com.questrail.pvl.model.IntegerValue;
import com.questrail.pvl.model.LabelValue;
import com.questrail.pvl.model.NullValue;
import com.questrail.pvl.model.RealValue;
import com.questrail.pvl.model.SequenceValue;
import com.questrail.pvl.model.SetValue;
import com.questrail.pvl.model.TextValue;
import com.questrail.pvl.model.UnitsValue;

import java.util.Collection;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * LabelValueCodec
 * -----------------------------------------------------------------------------
 * Turns a single {@link LabelValue} into the text that follows {@code " = "}.
 *
 * <p>Dispatch order:</p>
 * <ol>
 *   <li>units wrapper: inner value, then {@code " <units>"}</li>
 *   <li>text: verbatim, or quoted when the {@link TextQuoter} says so</li>
 *   <li>boolean: {@code TRUE} / {@code FALSE}</li>
 *   <li>integer / real: {@link Long#toString(long)} / {@link Double#toString(double)}</li>
 *   <li>null: {@code NULL}</li>
 *   <li>sequence: {@code (a, b)} in element order</li>
 *   <li>set: {@code {a, b}} in the set's iteration order</li>
 * </ol>
 *
 * <p>Anything else (nested mappings, opaque values) raises
 * {@link UnsupportedValueException}. Values are rendered to a string before
 * anything is written, so a failing entry produces no bytes.</p>
 */
final class LabelValueCodec
{
    static final String NULL = "NULL";
    static final String TRUE = "TRUE";
    static final String FALSE = "FALSE";

    private static final String SEPARATOR = ", ";

    private final TextQuoter quoter;

    LabelValueCodec(TextQuoter quoter)
    {
        this.quoter = Objects.requireNonNull(quoter, "quoter");
    }

    String encodeValue(LabelValue value)
    {
        Objects.requireNonNull(value, "value");

        if (value instanceof UnitsValue u) {
            return encodeValue(u.value()) + " <" + u.units() + ">";
        }
        if (value instanceof TextValue t) {
            return encodeText(t.value());
        }
        // Booleans are handled before numbers and never reach numeric formatting.
        if (value instanceof BooleanValue b) {
            return b.value() ? TRUE : FALSE;
        }
        if (value instanceof IntegerValue i) {
            return Long.toString(i.value());
        }
        if (value instanceof RealValue r) {
            return Double.toString(r.value());
        }
        if (value instanceof NullValue) {
            return NULL;
        }
        if (value instanceof SequenceValue s) {
            return encodeCollection(s.elements(), "(", ")");
        }
        if (value instanceof SetValue s) {
            return encodeCollection(s.elements(), "{", "}");
        }

        throw new UnsupportedValueException(value);
    }

    private String encodeText(String text)
    {
        if (quoter.needsQuotes(text)) {
            return quoter.quote(text);
        }
        return text;
    }

    private String encodeCollection(Collection<LabelValue> elements, String open, String close)
    {
        StringJoiner joiner = new StringJoiner(SEPARATOR, open, close);
        for (LabelValue element : elements) {
            joiner.add(encodeValue(element));
        }
        return joiner.toString();
    }
}
