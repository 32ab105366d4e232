package work.lcod.liquid.filters;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.runtime.FilterRegistry;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.text.HtmlEncoder;
import work.lcod.liquid.values.ArrayValue;
import work.lcod.liquid.values.Arguments;
import work.lcod.liquid.values.EmptyValue;
import work.lcod.liquid.values.NumberValue;
import work.lcod.liquid.values.StringValue;
import work.lcod.liquid.values.Value;
import work.lcod.liquid.values.ValueKind;
import work.lcod.liquid.values.Values;

/**
 * Small built-in filter set: string case and concatenation, arithmetic, array helpers and
 * HTML escaping.
 */
public final class StandardFilters {
    private StandardFilters() {}

    public static FilterRegistry register(FilterRegistry registry) {
        registry.register("upcase", StandardFilters::upcase);
        registry.register("downcase", StandardFilters::downcase);
        registry.register("capitalize", StandardFilters::capitalize);
        registry.register("append", StandardFilters::append);
        registry.register("prepend", StandardFilters::prepend);
        registry.register("size", StandardFilters::size);
        registry.register("default", StandardFilters::defaultValue);
        registry.register("plus", StandardFilters::plus);
        registry.register("minus", StandardFilters::minus);
        registry.register("times", StandardFilters::times);
        registry.register("join", StandardFilters::join);
        registry.register("first", (input, arguments, context) -> input.getValueAsync("first", context));
        registry.register("last", (input, arguments, context) -> input.getValueAsync("last", context));
        registry.register("escape", StandardFilters::escape);
        return registry;
    }

    private static CompletableFuture<Value> upcase(Value input, Arguments arguments, TemplateContext context) {
        return string(input.toStringValue().toUpperCase(Locale.ROOT));
    }

    private static CompletableFuture<Value> downcase(Value input, Arguments arguments, TemplateContext context) {
        return string(input.toStringValue().toLowerCase(Locale.ROOT));
    }

    private static CompletableFuture<Value> capitalize(Value input, Arguments arguments, TemplateContext context) {
        var text = input.toStringValue();
        if (text.isEmpty()) {
            return string(text);
        }
        return string(text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1));
    }

    private static CompletableFuture<Value> append(Value input, Arguments arguments, TemplateContext context) {
        return string(input.toStringValue() + arguments.at(0).toStringValue());
    }

    private static CompletableFuture<Value> prepend(Value input, Arguments arguments, TemplateContext context) {
        return string(arguments.at(0).toStringValue() + input.toStringValue());
    }

    private static CompletableFuture<Value> size(Value input, Arguments arguments, TemplateContext context) {
        return switch (input.kind()) {
            case ARRAY -> Values.completed(NumberValue.create(((ArrayValue) input).size()));
            case STRING -> Values.completed(NumberValue.create(input.toStringValue().length()));
            case OBJECT -> input.toObjectValue() instanceof Map<?, ?> map
                ? Values.completed(NumberValue.create(map.size()))
                : input.getValueAsync("size", context);
            default -> Values.completed(NumberValue.ZERO);
        };
    }

    private static CompletableFuture<Value> defaultValue(Value input, Arguments arguments, TemplateContext context) {
        if (!input.toBooleanValue() || input.equalTo(EmptyValue.INSTANCE)) {
            return Values.completed(arguments.at(0));
        }
        return Values.completed(input);
    }

    private static CompletableFuture<Value> plus(Value input, Arguments arguments, TemplateContext context) {
        return Values.completed(NumberValue.create(input.toNumberValue().add(arguments.at(0).toNumberValue())));
    }

    private static CompletableFuture<Value> minus(Value input, Arguments arguments, TemplateContext context) {
        return Values.completed(NumberValue.create(input.toNumberValue().subtract(arguments.at(0).toNumberValue())));
    }

    private static CompletableFuture<Value> times(Value input, Arguments arguments, TemplateContext context) {
        return Values.completed(NumberValue.create(input.toNumberValue().multiply(arguments.at(0).toNumberValue())));
    }

    private static CompletableFuture<Value> join(Value input, Arguments arguments, TemplateContext context) {
        if (input.kind() != ValueKind.ARRAY) {
            return Values.completed(input);
        }
        var separator = arguments.count() > 0 ? arguments.at(0).toStringValue() : " ";
        var builder = new StringBuilder();
        var items = ((ArrayValue) input).values();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                builder.append(separator);
            }
            builder.append(items.get(i).toStringValue());
        }
        return string(builder.toString());
    }

    private static CompletableFuture<Value> escape(Value input, Arguments arguments, TemplateContext context) {
        return Values.completed(new StringValue(HtmlEncoder.DEFAULT.encode(input.toStringValue()), false));
    }

    private static CompletableFuture<Value> string(String text) {
        return Values.completed(StringValue.create(text));
    }
}
