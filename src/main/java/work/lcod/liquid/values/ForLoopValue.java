package work.lcod.liquid.values;

import java.io.Writer;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.text.TextEncoder;

/**
 * The {@code forloop} object bound inside a loop body.
 */
public final class ForLoopValue extends Value {
    private final int index0;
    private final int length;

    public ForLoopValue(int index0, int length) {
        this.index0 = index0;
        this.length = length;
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
        return "forloop";
    }

    @Override
    public Object toObjectValue() {
        return this;
    }

    @Override
    public CompletableFuture<Value> getValueAsync(String name, TemplateContext context) {
        return Values.completed(member(name));
    }

    Value member(String name) {
        return switch (name) {
            case "index" -> NumberValue.create(index0 + 1);
            case "index0" -> NumberValue.create(index0);
            case "rindex" -> NumberValue.create(length - index0);
            case "rindex0" -> NumberValue.create(length - index0 - 1);
            case "first" -> BooleanValue.of(index0 == 0);
            case "last" -> BooleanValue.of(index0 == length - 1);
            case "length" -> NumberValue.create(length);
            default -> NilValue.INSTANCE;
        };
    }

    @Override
    public void writeTo(Writer writer, TextEncoder encoder, Locale locale) {
    }
}
