package work.lcod.liquid.runtime;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.AbstractList;
import java.util.List;
import java.util.RandomAccess;
import work.lcod.liquid.values.Value;

/**
 * Applies {@code offset}, then {@code limit}, then {@code reversed} to the items of a loop.
 * A missing (null or nil) offset starts at the first item and a missing limit takes every
 * remaining item. Supplied numbers are truncated and clamped to {@code [0, Integer.MAX_VALUE]}.
 */
public final class LoopWindow {
    private static final BigDecimal MAX = BigDecimal.valueOf(Integer.MAX_VALUE);

    private LoopWindow() {}

    public static <T> List<T> apply(List<T> items, Value offset, Value limit, boolean reversed) {
        int size = items.size();
        int from = (int) Math.min(isMissing(offset) ? 0 : clamp(offset), size);
        int to = isMissing(limit) ? size : (int) Math.min((long) from + clamp(limit), size);
        List<T> window = from == 0 && to == size ? items : items.subList(from, to);
        if (reversed && window.size() > 1) {
            return new Reversed<>(window);
        }
        return window;
    }

    /**
     * Truncates a loop bound to an int in {@code [0, Integer.MAX_VALUE]}.
     */
    public static int clamp(Value value) {
        var number = value.toNumberValue().setScale(0, RoundingMode.DOWN);
        if (number.signum() <= 0) {
            return 0;
        }
        return number.compareTo(MAX) >= 0 ? Integer.MAX_VALUE : number.intValue();
    }

    private static boolean isMissing(Value value) {
        return value == null || value.isNil();
    }

    private static final class Reversed<T> extends AbstractList<T> implements RandomAccess {
        private final List<T> source;

        Reversed(List<T> source) {
            this.source = source;
        }

        @Override
        public T get(int index) {
            return source.get(source.size() - 1 - index);
        }

        @Override
        public int size() {
            return source.size();
        }
    }
}
