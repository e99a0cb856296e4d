package com.questrail.pvl.codec;

import com.questrail.pvl.model.BooleanValue;
import com.questrail.pvl.model.IntegerValue;
import com.questrail.pvl.model.LabelValue;
import com.questrail.pvl.model.NullValue;
import com.questrail.pvl.model.TextValue;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Minimal reader for single-statement default-dialect labels holding a null,
 * boolean, integer or text value. Test use only.
 */
final class ScalarTextReader
{
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private ScalarTextReader() {}

    static LabelValue readSingleValue(String label)
    {
        if (!label.endsWith("\nEND")) {
            throw new IllegalArgumentException("Missing terminal: " + label);
        }
        String statement = label.substring(0, label.length() - "\nEND".length());
        int eq = statement.indexOf(" = ");
        if (eq < 0 || statement.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Not a single statement: " + statement);
        }
        return readValue(statement.substring(eq + 3));
    }

    private static LabelValue readValue(String text)
    {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return TextValue.of(text.substring(1, text.length() - 1));
            }
        }
        switch (text.toUpperCase(Locale.ROOT)) {
            case "NULL":
                return NullValue.INSTANCE;
            case "TRUE":
                return BooleanValue.TRUE;
            case "FALSE":
                return BooleanValue.FALSE;
            default:
                break;
        }
        if (INTEGER.matcher(text).matches()) {
            return IntegerValue.of(Long.parseLong(text));
        }
        return TextValue.of(text);
    }
}
