package work.lcod.liquid.compiler;

import java.lang.reflect.Array;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.liquid.values.TemplateFunction;
import work.lcod.liquid.values.Value;

/**
 * Static type checks for typed accessor chains.
 */
final class ModelTypes {
    private ModelTypes() {}

    /**
     * Whether instances of {@code type} are always wrapped as host objects read through the
     * member-access strategy.
     */
    static boolean isObjectLike(Class<?> type) {
        if (type == null || type.isPrimitive() || type.isArray() || type == Object.class || type.isInterface()) {
            return false;
        }
        return !(Map.class.isAssignableFrom(type)
            || Iterable.class.isAssignableFrom(type)
            || CharSequence.class.isAssignableFrom(type)
            || Number.class.isAssignableFrom(type)
            || Boolean.class == type
            || Character.class == type
            || Temporal.class.isAssignableFrom(type)
            || TemplateFunction.class.isAssignableFrom(type)
            || Value.class.isAssignableFrom(type));
    }

    static boolean isSequence(Class<?> type) {
        return type != null
            && (type.isArray() || Iterable.class.isAssignableFrom(type))
            && !Value.class.isAssignableFrom(type);
    }

    static List<Object> items(Object raw) {
        if (raw == null) {
            return List.of();
        }
        var items = new ArrayList<Object>();
        if (raw.getClass().isArray()) {
            int length = Array.getLength(raw);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(raw, i));
            }
            return items;
        }
        if (raw instanceof Iterable<?> iterable) {
            for (var item : iterable) {
                items.add(item);
            }
        }
        return items;
    }
}
