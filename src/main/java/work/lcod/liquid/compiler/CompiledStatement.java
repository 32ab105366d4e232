package work.lcod.liquid.compiler;

import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.flow.Completion;

@FunctionalInterface
interface CompiledStatement {
    CompletableFuture<Completion> execute(RenderFrame frame);
}
