package work.lcod.liquid.compiler;

import java.util.Set;

/**
 * What a lowering pass precomputed: folded constants, argument bundles built once, extracted
 * macros and model members read through typed accessors.
 */
public record CompilationStatistics(int constants, int cachedArgumentBundles, int macros, Set<String> fastPathRoots) {
    public CompilationStatistics {
        fastPathRoots = fastPathRoots == null ? Set.of() : Set.copyOf(fastPathRoots);
    }
}
