package work.lcod.liquid.values;

import java.io.Writer;
import java.math.BigDecimal;
import java.util.Locale;
import work.lcod.liquid.text.TextEncoder;

/**
 * The {@code empty} keyword.
 */
public final class EmptyValue extends Value {
    public static final EmptyValue INSTANCE = new EmptyValue();

    private EmptyValue() {}

    @Override
    public ValueKind kind() {
        return ValueKind.EMPTY;
    }

    @Override
    public boolean toBooleanValue() {
        return false;
    }

    @Override
    public BigDecimal toNumberValue() {
        return BigDecimal.ZERO;
    }

    @Override
    public String toStringValue() {
        return "";
    }

    @Override
    public Object toObjectValue() {
        return null;
    }

    @Override
    public void writeTo(Writer writer, TextEncoder encoder, Locale locale) {
    }
}
