package work.lcod.liquid.values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable argument bundle passed to filters and functions: every argument in call order, the
 * unnamed ones by position and the named ones by name.
 */
public final class Arguments {
    public static final Arguments EMPTY = new Arguments(List.of(), List.of(), Map.of());

    private final List<Value> all;
    private final List<Value> positional;
    private final Map<String, Value> named;

    private Arguments(List<Value> all, List<Value> positional, Map<String, Value> named) {
        this.all = all;
        this.positional = positional;
        this.named = named;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Arguments of(Value... values) {
        var builder = builder();
        for (var value : values) {
            builder.add(value);
        }
        return builder.build();
    }

    public int count() {
        return all.size();
    }

    /**
     * Argument at {@code index} in call order, named or not; Nil when out of range.
     */
    public Value at(int index) {
        return index >= 0 && index < all.size() ? all.get(index) : NilValue.INSTANCE;
    }

    public int positionalCount() {
        return positional.size();
    }

    public Value positional(int index) {
        return index >= 0 && index < positional.size() ? positional.get(index) : NilValue.INSTANCE;
    }

    public boolean has(String name) {
        return named.containsKey(name);
    }

    public Value get(String name) {
        var value = named.get(name);
        return value == null ? NilValue.INSTANCE : value;
    }

    public Set<String> names() {
        return named.keySet();
    }

    public List<Value> values() {
        return all;
    }

    public static final class Builder {
        private final List<Value> all = new ArrayList<>();
        private final List<Value> positional = new ArrayList<>();
        private final Map<String, Value> named = new LinkedHashMap<>();

        public Builder add(Value value) {
            all.add(value);
            positional.add(value);
            return this;
        }

        public Builder add(String name, Value value) {
            if (name == null || name.isEmpty()) {
                return add(value);
            }
            all.add(value);
            named.put(name, value);
            return this;
        }

        public Arguments build() {
            if (all.isEmpty()) {
                return EMPTY;
            }
            return new Arguments(
                Collections.unmodifiableList(new ArrayList<>(all)),
                Collections.unmodifiableList(new ArrayList<>(positional)),
                Collections.unmodifiableMap(new LinkedHashMap<>(named))
            );
        }
    }
}
