package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.core.Value;
import io.github.manjago.pseudomem.lang.DataType;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-to-value conversions shared by INPUT, READFILE, INT, REAL and CASE ranges.
 */
final class Conversions {

    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");
    private static final Pattern LEADING_DECIMAL =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");

    private Conversions() {
    }

    /**
     * Leading integer of the text, or NaN when there is none.
     */
    static double parseLeadingInteger(String text) {
        Matcher m = LEADING_INTEGER.matcher(text);
        if (!m.find()) {
            return Double.NaN;
        }
        return Double.parseDouble(m.group(1));
    }

    /**
     * Leading decimal number of the text, or NaN when there is none.
     */
    static double parseLeadingDecimal(String text) {
        Matcher m = LEADING_DECIMAL.matcher(text);
        if (!m.find()) {
            return Double.NaN;
        }
        return Double.parseDouble(m.group(1));
    }

    /**
     * Convert entered or read text to a value of the target's declared type.
     * Unparsable numbers become 0.
     */
    static Value fromInput(String text, DataType type) {
        return switch (type) {
            case INTEGER -> Value.of(orZero(parseLeadingInteger(text)));
            case REAL -> Value.of(orZero(parseLeadingDecimal(text)));
            case BOOLEAN -> Value.of(text.equalsIgnoreCase("true"));
            default -> Value.of(text);
        };
    }

    /**
     * Numeric reading of a value for CASE ranges; NaN when it has none.
     */
    static double numericCoercion(Value value) {
        if (value instanceof Value.Num num) {
            return num.value();
        }
        if (value instanceof Value.Address address) {
            return address.value();
        }
        if (value instanceof Value.Text text) {
            return parseLeadingDecimal(text.value());
        }
        return Double.NaN;
    }

    private static double orZero(double value) {
        return Double.isNaN(value) ? 0 : value;
    }
}
