package work.lcod.liquid.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores filters by name. Populated during setup, read during rendering.
 */
public final class FilterRegistry {
    private final Map<String, FilterFunction> filters = new ConcurrentHashMap<>();

    public FilterRegistry register(String name, FilterFunction filter) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(filter, "filter");
        filters.put(name, filter);
        return this;
    }

    public FilterFunction get(String name) {
        return name == null ? null : filters.get(name);
    }

    public boolean contains(String name) {
        return name != null && filters.containsKey(name);
    }

    public void unregister(String name) {
        if (name != null) {
            filters.remove(name);
        }
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(filters.keySet());
    }
}
