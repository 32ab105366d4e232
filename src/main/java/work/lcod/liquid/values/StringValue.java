package work.lcod.liquid.values;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.text.TextEncoder;

/**
 * Text value. Strings built from already rendered output (macro results, captures) are flagged
 * so they are not encoded twice.
 */
public final class StringValue extends Value {
    public static final StringValue EMPTY = new StringValue("", true);

    private final String value;
    private final boolean encode;

    public StringValue(String value, boolean encode) {
        this.value = value == null ? "" : value;
        this.encode = encode;
    }

    public static StringValue create(String value) {
        return value == null || value.isEmpty() ? EMPTY : new StringValue(value, true);
    }

    public String value() {
        return value;
    }

    public boolean encode() {
        return encode;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.STRING;
    }

    @Override
    public boolean toBooleanValue() {
        return true;
    }

    @Override
    public BigDecimal toNumberValue() {
        var trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(trimmed);
        } catch (NumberFormatException ex) {
            return BigDecimal.ZERO;
        }
    }

    @Override
    public String toStringValue() {
        return value;
    }

    @Override
    public Object toObjectValue() {
        return value;
    }

    @Override
    public boolean contains(Value other) {
        if (other.isNil()) {
            return false;
        }
        return value.contains(other.toStringValue());
    }

    @Override
    public CompletableFuture<Value> getValueAsync(String name, TemplateContext context) {
        return switch (name) {
            case "size" -> Values.completed(NumberValue.create(value.length()));
            case "first" -> Values.completed(value.isEmpty() ? NilValue.INSTANCE : create(value.substring(0, 1)));
            case "last" -> Values.completed(value.isEmpty() ? NilValue.INSTANCE : create(value.substring(value.length() - 1)));
            default -> Values.nil();
        };
    }

    @Override
    public CompletableFuture<Value> getIndexAsync(Value index, TemplateContext context) {
        if (index.kind() != ValueKind.NUMBER) {
            return getValueAsync(index.toStringValue(), context);
        }
        int position = Values.toIndex(index.toNumberValue(), value.length());
        if (position < 0) {
            return Values.nil();
        }
        return Values.completed(create(value.substring(position, position + 1)));
    }

    @Override
    public CompletableFuture<List<Value>> enumerateAsync(TemplateContext context) {
        return CompletableFuture.completedFuture(List.of(this));
    }

    @Override
    public void writeTo(Writer writer, TextEncoder encoder, Locale locale) throws IOException {
        if (value.isEmpty()) {
            return;
        }
        if (encode) {
            encoder.encode(writer, value);
        } else {
            writer.write(value);
        }
    }
}
