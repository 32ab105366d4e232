package work.lcod.liquid.runtime;

import java.util.HashMap;
import java.util.Map;
import work.lcod.liquid.values.Value;

/**
 * One frame of the scope stack. Lookups walk the parent chain; writes stay in this frame.
 */
final class Scope {
    private final Scope parent;
    private final int depth;
    private final Map<String, Value> values = new HashMap<>();

    Scope(Scope parent) {
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    Scope parent() {
        return parent;
    }

    Value find(String name) {
        for (var scope = this; scope != null; scope = scope.parent) {
            var value = scope.values.get(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    void set(String name, Value value) {
        values.put(name, value);
    }

    int depth() {
        return depth;
    }
}
