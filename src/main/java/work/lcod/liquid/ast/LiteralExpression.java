package work.lcod.liquid.ast;

import java.util.Objects;
import work.lcod.liquid.values.Value;

public final class LiteralExpression extends Expression {
    private final Value value;

    public LiteralExpression(Value value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public Value value() {
        return value;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.LITERAL;
    }
}
