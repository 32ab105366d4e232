package work.lcod.liquid.values;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.runtime.MemberAccessor;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.runtime.TemplateOptions;
import work.lcod.liquid.text.TextEncoder;

/**
 * Wraps a host object. Maps are read by key; any other object is read through the member-access
 * strategy configured on the render options.
 */
public final class ObjectValue extends Value {
    private final Object host;

    public ObjectValue(Object host) {
        this.host = Objects.requireNonNull(host, "host");
    }

    public Object host() {
        return host;
    }

    /**
     * Synchronous member lookup shared by value navigation and by the context's model fallback.
     */
    public Value getMember(String name, TemplateOptions options) {
        if (host instanceof Map<?, ?> map) {
            if (map.containsKey(name)) {
                return Values.create(map.get(name), options);
            }
            if ("size".equals(name)) {
                return NumberValue.create(map.size());
            }
            return NilValue.INSTANCE;
        }
        MemberAccessor accessor = options.memberAccessStrategy().getAccessor(host.getClass(), name);
        if (accessor == null) {
            return NilValue.INSTANCE;
        }
        return Values.create(accessor.get(host), options);
    }

    public boolean hasMember(String name, TemplateOptions options) {
        if (host instanceof Map<?, ?> map) {
            return map.containsKey(name);
        }
        return options.memberAccessStrategy().getAccessor(host.getClass(), name) != null;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.OBJECT;
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
        return String.valueOf(host);
    }

    @Override
    public Object toObjectValue() {
        return host;
    }

    @Override
    public boolean contains(Value value) {
        if (value.isNil()) {
            return false;
        }
        if (host instanceof Map<?, ?> map) {
            return map.containsKey(value.toStringValue());
        }
        return false;
    }

    /**
     * Key presence that also consults registered members.
     */
    public boolean contains(Value value, TemplateOptions options) {
        if (value.isNil()) {
            return false;
        }
        return hasMember(value.toStringValue(), options);
    }

    @Override
    public CompletableFuture<Value> getValueAsync(String name, TemplateContext context) {
        return Values.completed(getMember(name, context.options()));
    }

    @Override
    public CompletableFuture<List<Value>> enumerateAsync(TemplateContext context) {
        if (host instanceof Map<?, ?> map) {
            var entries = new ArrayList<Value>(map.size());
            for (var entry : map.entrySet()) {
                entries.add(new ArrayValue(List.of(
                    StringValue.create(String.valueOf(entry.getKey())),
                    Values.create(entry.getValue(), context.options())
                )));
            }
            return CompletableFuture.completedFuture(entries);
        }
        return CompletableFuture.completedFuture(List.of(this));
    }

    @Override
    public void writeTo(Writer writer, TextEncoder encoder, Locale locale) throws IOException {
        encoder.encode(writer, toStringValue());
    }
}
