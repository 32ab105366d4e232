package work.lcod.liquid.runtime;

import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.ast.BinaryOperator;
import work.lcod.liquid.values.BooleanValue;
import work.lcod.liquid.values.Value;
import work.lcod.liquid.values.Values;

/**
 * Operator rules applied to already evaluated operands.
 */
public final class BinaryOperations {
    private BinaryOperations() {}

    public static CompletableFuture<Value> apply(BinaryOperator operator, Value left, Value right, boolean strict, TemplateContext context) {
        return switch (operator) {
            case EQUAL -> Values.completed(BooleanValue.of(left.equalTo(right)));
            case NOT_EQUAL -> Values.completed(BooleanValue.of(!left.equalTo(right)));
            case AND -> Values.completed(BooleanValue.of(left.toBooleanValue() && right.toBooleanValue()));
            case OR -> Values.completed(BooleanValue.of(left.toBooleanValue() || right.toBooleanValue()));
            case CONTAINS -> Values.completed(BooleanValue.of(Values.contains(left, right, context == null ? null : context.options())));
            case LOWER_THAN -> Values.completed(Values.compare(left, right, strict, true));
            case GREATER_THAN -> Values.completed(Values.compare(left, right, strict, false));
            case STARTS_WITH -> Values.startsWithAsync(left, right);
            case ENDS_WITH -> Values.endsWithAsync(left, right);
        };
    }
}
