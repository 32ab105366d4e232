package work.lcod.liquid.values;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import work.lcod.liquid.text.TextEncoder;

public final class NumberValue extends Value {
    public static final NumberValue ZERO = new NumberValue(BigDecimal.ZERO);

    private final BigDecimal value;

    private NumberValue(BigDecimal value) {
        this.value = value;
    }

    public static NumberValue create(BigDecimal value) {
        return value == null ? ZERO : new NumberValue(value);
    }

    public static NumberValue create(long value) {
        return value == 0 ? ZERO : new NumberValue(BigDecimal.valueOf(value));
    }

    public static NumberValue create(Number value) {
        return create(toDecimal(value));
    }

    /**
     * Converts any boxed number to the decimal representation used by the engine. Non-finite
     * doubles become zero.
     */
    public static BigDecimal toDecimal(Number number) {
        if (number == null) {
            return BigDecimal.ZERO;
        }
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            double raw = number.doubleValue();
            if (Double.isNaN(raw) || Double.isInfinite(raw)) {
                return BigDecimal.ZERO;
            }
            return BigDecimal.valueOf(raw);
        }
        return BigDecimal.valueOf(number.longValue());
    }

    /**
     * Formats a decimal the way output statements print it: plain notation with the locale's
     * decimal separator.
     */
    public static String format(BigDecimal value, Locale locale) {
        var plain = value.toPlainString();
        if (locale == null || value.scale() <= 0) {
            return plain;
        }
        char separator = DecimalFormatSymbols.getInstance(locale).getDecimalSeparator();
        return separator == '.' ? plain : plain.replace('.', separator);
    }

    public BigDecimal value() {
        return value;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.NUMBER;
    }

    @Override
    public boolean toBooleanValue() {
        return true;
    }

    @Override
    public BigDecimal toNumberValue() {
        return value;
    }

    @Override
    public String toStringValue() {
        return value.toPlainString();
    }

    @Override
    public Object toObjectValue() {
        return value;
    }

    @Override
    public void writeTo(Writer writer, TextEncoder encoder, Locale locale) throws IOException {
        encoder.encode(writer, format(value, locale));
    }
}
