package work.lcod.liquid.values;

import java.io.Writer;
import java.math.BigDecimal;
import java.util.Locale;
import work.lcod.liquid.text.TextEncoder;

/**
 * The {@code blank} keyword.
 */
public final class BlankValue extends Value {
    public static final BlankValue INSTANCE = new BlankValue();

    private BlankValue() {}

    @Override
    public ValueKind kind() {
        return ValueKind.BLANK;
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
