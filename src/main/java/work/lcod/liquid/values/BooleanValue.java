package work.lcod.liquid.values;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.Locale;
import work.lcod.liquid.text.TextEncoder;

public final class BooleanValue extends Value {
    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    private final boolean value;

    private BooleanValue(boolean value) {
        this.value = value;
    }

    public static BooleanValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.BOOLEAN;
    }

    @Override
    public boolean toBooleanValue() {
        return value;
    }

    @Override
    public BigDecimal toNumberValue() {
        return value ? BigDecimal.ONE : BigDecimal.ZERO;
    }

    @Override
    public String toStringValue() {
        return value ? "true" : "false";
    }

    @Override
    public Object toObjectValue() {
        return value;
    }

    @Override
    public void writeTo(Writer writer, TextEncoder encoder, Locale locale) throws IOException {
        encoder.encode(writer, toStringValue());
    }
}
