package work.lcod.liquid.compiler;

import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.values.Value;

@FunctionalInterface
interface ValueEvaluator {
    CompletableFuture<Value> evaluate(RenderFrame frame);
}
