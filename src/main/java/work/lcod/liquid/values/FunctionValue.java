package work.lcod.liquid.values;

import java.io.Writer;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.text.TextEncoder;

public final class FunctionValue extends Value {
    private final TemplateFunction function;

    public FunctionValue(TemplateFunction function) {
        this.function = Objects.requireNonNull(function, "function");
    }

    public TemplateFunction function() {
        return function;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.FUNCTION;
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
        return "";
    }

    @Override
    public Object toObjectValue() {
        return function;
    }

    @Override
    public CompletableFuture<Value> invokeAsync(Arguments arguments, TemplateContext context) {
        return function.invokeAsync(arguments, context);
    }

    @Override
    public void writeTo(Writer writer, TextEncoder encoder, Locale locale) {
    }
}
