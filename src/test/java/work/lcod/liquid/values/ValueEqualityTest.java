package work.lcod.liquid.values;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValueEqualityTest {
    private static final Value NIL = NilValue.INSTANCE;
    private static final Value BLANK = BlankValue.INSTANCE;
    private static final Value EMPTY = EmptyValue.INSTANCE;

    @Test
    void nilEqualsOnlyNilLikeValues() {
        assertTrue(NIL.equalTo(NIL));
        assertTrue(NIL.equalTo(BLANK));
        assertTrue(NIL.equalTo(EMPTY));
        assertFalse(NIL.equalTo(StringValue.EMPTY));
        assertFalse(NIL.equalTo(BooleanValue.FALSE));
        assertFalse(StringValue.EMPTY.equalTo(NIL));
    }

    @Test
    void blankMatchesFalseWhitespaceAndEmptyCollections() {
        assertTrue(BLANK.equalTo(BooleanValue.FALSE));
        assertTrue(BLANK.equalTo(StringValue.create("  \t")));
        assertTrue(BLANK.equalTo(StringValue.EMPTY));
        assertTrue(BLANK.equalTo(ArrayValue.EMPTY));
        assertTrue(BLANK.equalTo(new ObjectValue(Map.of())));
        assertTrue(StringValue.create(" ").equalTo(BLANK));
        assertFalse(BLANK.equalTo(BooleanValue.TRUE));
        assertFalse(BLANK.equalTo(StringValue.create(" x ")));
        assertFalse(BLANK.equalTo(NumberValue.ZERO));
    }

    @Test
    void emptyMatchesEmptyStringsAndCollections() {
        assertTrue(EMPTY.equalTo(StringValue.EMPTY));
        assertTrue(EMPTY.equalTo(ArrayValue.EMPTY));
        assertTrue(EMPTY.equalTo(new ObjectValue(Map.of())));
        assertTrue(ArrayValue.EMPTY.equalTo(EMPTY));
        assertFalse(EMPTY.equalTo(StringValue.create(" ")));
        assertFalse(EMPTY.equalTo(BooleanValue.FALSE));
        assertFalse(EMPTY.equalTo(new ArrayValue(List.of(NumberValue.ZERO))));
    }

    @Test
    void numbersCompareByMagnitude() {
        assertTrue(NumberValue.create(new BigDecimal("1.50")).equalTo(NumberValue.create(new BigDecimal("1.5"))));
        assertTrue(NumberValue.create(2).equalTo(NumberValue.create(2.0d)));
        assertFalse(NumberValue.create(2).equalTo(StringValue.create("2")));
    }

    @Test
    void arraysCompareElementWise() {
        var left = new ArrayValue(List.of(NumberValue.create(1), StringValue.create("a")));
        var right = new ArrayValue(List.of(NumberValue.create(new BigDecimal("1.0")), StringValue.create("a")));
        var shorter = new ArrayValue(List.of(NumberValue.create(1)));
        assertTrue(left.equalTo(right));
        assertFalse(left.equalTo(shorter));
    }

    @Test
    void functionsCompareByIdentity() {
        TemplateFunction function = (arguments, context) -> Values.nil();
        assertTrue(new FunctionValue(function).equalTo(new FunctionValue(function)));
        assertFalse(new FunctionValue(function).equalTo(new FunctionValue((arguments, context) -> Values.nil())));
    }

    @Test
    void onlyNilLikeValuesAndFalseAreFalsy() {
        assertFalse(NIL.toBooleanValue());
        assertFalse(BLANK.toBooleanValue());
        assertFalse(EMPTY.toBooleanValue());
        assertFalse(BooleanValue.FALSE.toBooleanValue());
        assertTrue(NumberValue.ZERO.toBooleanValue());
        assertTrue(StringValue.EMPTY.toBooleanValue());
        assertTrue(ArrayValue.EMPTY.toBooleanValue());
    }
}
