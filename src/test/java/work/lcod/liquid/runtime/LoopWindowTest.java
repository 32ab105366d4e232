package work.lcod.liquid.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.liquid.values.NilValue;
import work.lcod.liquid.values.NumberValue;

class LoopWindowTest {
    private static final List<Integer> ITEMS = List.of(1, 2, 3, 4);

    @Test
    void missingBoundsKeepEveryItem() {
        assertEquals(ITEMS, LoopWindow.apply(ITEMS, null, null, false));
        assertEquals(ITEMS, LoopWindow.apply(ITEMS, NilValue.INSTANCE, NilValue.INSTANCE, false));
        assertEquals(List.of(4, 3, 2, 1), LoopWindow.apply(ITEMS, null, null, true));
    }

    @Test
    void offsetThenLimitThenReverse() {
        assertEquals(List.of(3, 2), LoopWindow.apply(ITEMS, NumberValue.create(1), NumberValue.create(2), true));
        assertEquals(List.of(2, 3, 4), LoopWindow.apply(ITEMS, NumberValue.create(1), NumberValue.create(Integer.MAX_VALUE), false));
        assertEquals(List.of(), LoopWindow.apply(ITEMS, NumberValue.create(9), null, false));
    }

    @Test
    void boundsAreTruncatedAndClamped() {
        assertEquals(0, LoopWindow.clamp(NumberValue.create(-1)));
        assertEquals(1, LoopWindow.clamp(NumberValue.create(new BigDecimal("1.9"))));
        assertEquals(Integer.MAX_VALUE, LoopWindow.clamp(NumberValue.create(5_000_000_000L)));
        assertEquals(List.of(), LoopWindow.apply(ITEMS, null, NumberValue.create(-1), false));
        assertEquals(List.of(1), LoopWindow.apply(ITEMS, NumberValue.create(-3), NumberValue.create(1), false));
    }
}
