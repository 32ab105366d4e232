package work.lcod.liquid.values;

import java.io.Writer;
import java.math.BigDecimal;
import java.util.Locale;
import work.lcod.liquid.text.TextEncoder;

public final class NilValue extends Value {
    public static final NilValue INSTANCE = new NilValue();

    private NilValue() {}

    @Override
    public ValueKind kind() {
        return ValueKind.NIL;
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
    public boolean isNil() {
        return true;
    }

    @Override
    public void writeTo(Writer writer, TextEncoder encoder, Locale locale) {
    }
}
