package work.lcod.liquid.values;

import java.util.AbstractList;
import java.util.RandomAccess;

/**
 * Read-only list of consecutive integers, each number created when it is read.
 */
final class RangeList extends AbstractList<Value> implements RandomAccess {
    private final long start;
    private final int size;

    RangeList(long start, int size) {
        this.start = start;
        this.size = size;
    }

    @Override
    public Value get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range 0.." + size);
        }
        return NumberValue.create(start + index);
    }

    @Override
    public int size() {
        return size;
    }
}
