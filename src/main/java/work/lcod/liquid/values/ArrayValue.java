package work.lcod.liquid.values;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.text.TextEncoder;

public final class ArrayValue extends Value {
    public static final ArrayValue EMPTY = new ArrayValue(List.of());

    private final List<Value> values;

    public ArrayValue(List<Value> values) {
        if (values == null || values.isEmpty()) {
            this.values = List.of();
        } else if (values instanceof RangeList) {
            this.values = values;
        } else {
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
        }
    }

    public List<Value> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public ValueKind kind() {
        return ValueKind.ARRAY;
    }

    @Override
    public boolean toBooleanValue() {
        return true;
    }

    @Override
    public BigDecimal toNumberValue() {
        return BigDecimal.ZERO;
    }

    @Override
    public String toStringValue() {
        var builder = new StringBuilder();
        for (var value : values) {
            builder.append(value.toStringValue());
        }
        return builder.toString();
    }

    @Override
    public Object toObjectValue() {
        var list = new ArrayList<Object>(values.size());
        for (var value : values) {
            list.add(value.toObjectValue());
        }
        return list;
    }

    @Override
    public boolean contains(Value value) {
        for (var item : values) {
            if (item.equalTo(value)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public CompletableFuture<Value> getValueAsync(String name, TemplateContext context) {
        return switch (name) {
            case "size" -> Values.completed(NumberValue.create(values.size()));
            case "first" -> Values.completed(values.isEmpty() ? NilValue.INSTANCE : values.get(0));
            case "last" -> Values.completed(values.isEmpty() ? NilValue.INSTANCE : values.get(values.size() - 1));
            default -> Values.nil();
        };
    }

    @Override
    public CompletableFuture<Value> getIndexAsync(Value index, TemplateContext context) {
        if (index.kind() != ValueKind.NUMBER) {
            return getValueAsync(index.toStringValue(), context);
        }
        int position = Values.toIndex(index.toNumberValue(), values.size());
        return position < 0 ? Values.nil() : Values.completed(values.get(position));
    }

    @Override
    public CompletableFuture<List<Value>> enumerateAsync(TemplateContext context) {
        return CompletableFuture.completedFuture(values);
    }

    @Override
    public void writeTo(Writer writer, TextEncoder encoder, Locale locale) throws IOException {
        for (var value : values) {
            value.writeTo(writer, encoder, locale);
        }
    }
}
