package work.lcod.liquid.ast;

import java.util.Objects;

public final class RangeExpression extends Expression {
    private final Expression from;
    private final Expression to;

    public RangeExpression(Expression from, Expression to) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public Expression from() {
        return from;
    }

    public Expression to() {
        return to;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.RANGE;
    }
}
