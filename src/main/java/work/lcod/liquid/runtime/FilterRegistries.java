package work.lcod.liquid.runtime;

import work.lcod.liquid.filters.StandardFilters;

/**
 * Shared filter bootstrap so the CLI, the embedding API and tests use the same filter set.
 */
public final class FilterRegistries {
    private FilterRegistries() {}

    public static FilterRegistry create() {
        var registry = new FilterRegistry();
        StandardFilters.register(registry);
        return registry;
    }
}
