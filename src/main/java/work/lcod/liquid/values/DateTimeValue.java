package work.lcod.liquid.values;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import work.lcod.liquid.text.TextEncoder;

public final class DateTimeValue extends Value {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final ZonedDateTime value;

    public DateTimeValue(ZonedDateTime value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public ZonedDateTime value() {
        return value;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.DATE_TIME;
    }

    @Override
    public boolean toBooleanValue() {
        return true;
    }

    @Override
    public BigDecimal toNumberValue() {
        return BigDecimal.valueOf(value.toEpochSecond());
    }

    @Override
    public String toStringValue() {
        return FORMAT.format(value);
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
