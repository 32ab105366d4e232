package work.lcod.liquid.values;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.runtime.TemplateOptions;

/**
 * Conversion and comparison rules shared by the interpreter and the compiled templates.
 */
public final class Values {
    private static final BigDecimal MAX_ITEMS = BigDecimal.valueOf(Integer.MAX_VALUE);
    private static final CompletableFuture<Value> NIL = CompletableFuture.completedFuture(NilValue.INSTANCE);
    private static final CompletableFuture<Value> TRUE = CompletableFuture.completedFuture(BooleanValue.TRUE);
    private static final CompletableFuture<Value> FALSE = CompletableFuture.completedFuture(BooleanValue.FALSE);

    private Values() {}

    public static CompletableFuture<Value> nil() {
        return NIL;
    }

    public static CompletableFuture<Value> completed(Value value) {
        if (value == null || value == NilValue.INSTANCE) {
            return NIL;
        }
        if (value == BooleanValue.TRUE) {
            return TRUE;
        }
        if (value == BooleanValue.FALSE) {
            return FALSE;
        }
        return CompletableFuture.completedFuture(value);
    }

    /**
     * Wraps a host object into a value. Collections are converted eagerly, other objects are
     * read lazily through the member-access strategy.
     */
    public static Value create(Object value, TemplateOptions options) {
        if (value == null) {
            return NilValue.INSTANCE;
        }
        if (value instanceof Value existing) {
            return existing;
        }
        if (value instanceof Boolean bool) {
            return BooleanValue.of(bool);
        }
        if (value instanceof Number number) {
            return NumberValue.create(number);
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return StringValue.create(value.toString());
        }
        if (value instanceof TemplateFunction function) {
            return new FunctionValue(function);
        }
        if (value instanceof Map<?, ?>) {
            return new ObjectValue(value);
        }
        if (value instanceof Iterable<?> iterable) {
            var items = new ArrayList<Value>();
            for (var item : iterable) {
                items.add(create(item, options));
            }
            return new ArrayValue(items);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            var items = new ArrayList<Value>(length);
            for (int i = 0; i < length; i++) {
                items.add(create(Array.get(value, i), options));
            }
            return new ArrayValue(items);
        }
        if (value instanceof Temporal temporal) {
            var dateTime = toDateTime(temporal);
            if (dateTime != null) {
                return new DateTimeValue(dateTime);
            }
        }
        return new ObjectValue(value);
    }

    private static ZonedDateTime toDateTime(Temporal temporal) {
        if (temporal instanceof ZonedDateTime zoned) {
            return zoned;
        }
        if (temporal instanceof OffsetDateTime offset) {
            return offset.toZonedDateTime();
        }
        if (temporal instanceof Instant instant) {
            return instant.atZone(ZoneOffset.UTC);
        }
        if (temporal instanceof LocalDateTime local) {
            return local.atZone(ZoneOffset.UTC);
        }
        if (temporal instanceof LocalDate date) {
            return date.atStartOfDay(ZoneOffset.UTC);
        }
        return null;
    }

    public static boolean areEqual(Value left, Value right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        switch (left.kind()) {
            case NIL:
                return isNilLike(right);
            case BLANK:
                return isBlankLike(right);
            case EMPTY:
                return isEmptyLike(right);
            default:
                break;
        }
        switch (right.kind()) {
            case NIL:
                return false;
            case BLANK:
                return isBlankLike(left);
            case EMPTY:
                return isEmptyLike(left);
            default:
                break;
        }
        if (left.kind() != right.kind()) {
            return false;
        }
        return switch (left.kind()) {
            case BOOLEAN -> left.toBooleanValue() == right.toBooleanValue();
            case NUMBER -> left.toNumberValue().compareTo(right.toNumberValue()) == 0;
            case STRING -> left.toStringValue().equals(right.toStringValue());
            case ARRAY -> arraysEqual((ArrayValue) left, (ArrayValue) right);
            case DATE_TIME -> ((DateTimeValue) left).value().toInstant()
                .equals(((DateTimeValue) right).value().toInstant());
            case FUNCTION -> ((FunctionValue) left).function() == ((FunctionValue) right).function();
            case OBJECT -> Objects.equals(left.toObjectValue(), right.toObjectValue());
            case NIL, BLANK, EMPTY -> true;
        };
    }

    private static boolean arraysEqual(ArrayValue left, ArrayValue right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!areEqual(left.values().get(i), right.values().get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isNilLike(Value value) {
        return value.kind() == ValueKind.NIL || value.kind() == ValueKind.BLANK || value.kind() == ValueKind.EMPTY;
    }

    private static boolean isBlankLike(Value value) {
        return switch (value.kind()) {
            case NIL, BLANK, EMPTY -> true;
            case BOOLEAN -> !value.toBooleanValue();
            case STRING -> value.toStringValue().isBlank();
            case ARRAY -> ((ArrayValue) value).size() == 0;
            case OBJECT -> isEmptyObject(value);
            default -> false;
        };
    }

    private static boolean isEmptyLike(Value value) {
        return switch (value.kind()) {
            case NIL, BLANK, EMPTY -> true;
            case STRING -> value.toStringValue().isEmpty();
            case ARRAY -> ((ArrayValue) value).size() == 0;
            case OBJECT -> isEmptyObject(value);
            default -> false;
        };
    }

    private static boolean isEmptyObject(Value value) {
        return value.toObjectValue() instanceof Map<?, ?> map && map.isEmpty();
    }

    /**
     * Numeric ordering. Returns Nil unless both operands are numbers.
     */
    public static Value compare(Value left, Value right, boolean strict, boolean lower) {
        if (left.kind() != ValueKind.NUMBER || right.kind() != ValueKind.NUMBER) {
            return NilValue.INSTANCE;
        }
        int order = left.toNumberValue().compareTo(right.toNumberValue());
        boolean result = lower
            ? (strict ? order < 0 : order <= 0)
            : (strict ? order > 0 : order >= 0);
        return BooleanValue.of(result);
    }

    public static boolean contains(Value container, Value item, TemplateOptions options) {
        if (container instanceof ObjectValue object && options != null) {
            return object.contains(item, options);
        }
        return container.contains(item);
    }

    public static CompletableFuture<Value> startsWithAsync(Value source, Value prefix) {
        if (source.kind() != ValueKind.STRING || prefix.kind() != ValueKind.STRING) {
            return FALSE;
        }
        return completed(BooleanValue.of(source.toStringValue().startsWith(prefix.toStringValue())));
    }

    public static CompletableFuture<Value> endsWithAsync(Value source, Value suffix) {
        if (source.kind() != ValueKind.STRING || suffix.kind() != ValueKind.STRING) {
            return FALSE;
        }
        return completed(BooleanValue.of(source.toStringValue().endsWith(suffix.toStringValue())));
    }

    /**
     * Inclusive integer range; empty when {@code from} is greater than {@code to}. Items are
     * computed on access, and the range holds at most {@code Integer.MAX_VALUE} of them.
     */
    public static ArrayValue range(Value from, Value to) {
        var first = from.toNumberValue().setScale(0, RoundingMode.DOWN);
        var last = to.toNumberValue().setScale(0, RoundingMode.DOWN);
        if (first.compareTo(last) > 0) {
            return ArrayValue.EMPTY;
        }
        var count = last.subtract(first).add(BigDecimal.ONE);
        int size = count.compareTo(MAX_ITEMS) >= 0 ? Integer.MAX_VALUE : count.intValue();
        return new ArrayValue(new RangeList(first.longValue(), size));
    }

    /**
     * Resolves a possibly negative index against a collection size; -1 when out of range.
     */
    public static int toIndex(BigDecimal index, int size) {
        var truncated = index.setScale(0, RoundingMode.DOWN);
        if (truncated.abs().compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
            return -1;
        }
        int position = truncated.intValue();
        if (position < 0) {
            position += size;
        }
        return position >= 0 && position < size ? position : -1;
    }

}
