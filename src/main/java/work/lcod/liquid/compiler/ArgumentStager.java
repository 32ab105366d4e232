package work.lcod.liquid.compiler;

import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.values.Arguments;

/**
 * Produces the argument bundle of a filter or call, either a bundle built at compile time or
 * one rebuilt on every call.
 */
@FunctionalInterface
interface ArgumentStager {
    CompletableFuture<Arguments> stage(RenderFrame frame);
}
