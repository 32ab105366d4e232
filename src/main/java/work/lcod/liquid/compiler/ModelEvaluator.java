package work.lcod.liquid.compiler;

/**
 * Synchronous read of a raw host object along a typed accessor chain.
 */
@FunctionalInterface
interface ModelEvaluator {
    Object read(RenderFrame frame);
}
