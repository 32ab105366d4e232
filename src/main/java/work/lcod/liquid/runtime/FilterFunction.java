package work.lcod.liquid.runtime;

import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.values.Arguments;
import work.lcod.liquid.values.Value;

/**
 * A filter applied with {@code input | name: arguments}.
 */
@FunctionalInterface
public interface FilterFunction {
    CompletableFuture<Value> invoke(Value input, Arguments arguments, TemplateContext context);
}
