package work.lcod.liquid.values;

import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.runtime.TemplateContext;

/**
 * Callable carried by a {@link FunctionValue}; macros compile to one.
 */
@FunctionalInterface
public interface TemplateFunction {
    CompletableFuture<Value> invokeAsync(Arguments arguments, TemplateContext context);
}
