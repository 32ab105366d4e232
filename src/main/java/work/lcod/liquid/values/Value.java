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
 * Runtime representation of every quantity a template can render or compare. The set of variants
 * is closed and identified by {@link #kind()}; conversions never fail.
 */
public abstract class Value {
    Value() {}

    public abstract ValueKind kind();

    public abstract boolean toBooleanValue();

    public abstract BigDecimal toNumberValue();

    public abstract String toStringValue();

    /**
     * The host representation of this value (a {@code BigDecimal}, a {@code String}, the wrapped
     * object, ...), {@code null} for the nil-like values.
     */
    public abstract Object toObjectValue();

    public abstract void writeTo(Writer writer, TextEncoder encoder, Locale locale) throws IOException;

    /**
     * Language equality, see {@link Values#areEqual(Value, Value)}.
     */
    public final boolean equalTo(Value other) {
        return Values.areEqual(this, other);
    }

    public boolean isNil() {
        return false;
    }

    public boolean contains(Value value) {
        return false;
    }

    public CompletableFuture<Value> getValueAsync(String name, TemplateContext context) {
        return Values.nil();
    }

    public CompletableFuture<Value> getIndexAsync(Value index, TemplateContext context) {
        return getValueAsync(index.toStringValue(), context);
    }

    public CompletableFuture<Value> invokeAsync(Arguments arguments, TemplateContext context) {
        return Values.nil();
    }

    public CompletableFuture<List<Value>> enumerateAsync(TemplateContext context) {
        return CompletableFuture.completedFuture(List.of());
    }

    @Override
    public String toString() {
        return kind() + "(" + toStringValue() + ")";
    }
}
