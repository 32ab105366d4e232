package work.lcod.liquid.ast;

import java.util.Objects;

/**
 * Binary operator application. {@code strict} only matters for the ordering operators
 * ({@code <} versus {@code <=}).
 */
public final class BinaryExpression extends Expression {
    private final BinaryOperator operator;
    private final Expression left;
    private final Expression right;
    private final boolean strict;

    public BinaryExpression(BinaryOperator operator, Expression left, Expression right) {
        this(operator, left, right, true);
    }

    public BinaryExpression(BinaryOperator operator, Expression left, Expression right, boolean strict) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.strict = strict;
    }

    public BinaryOperator operator() {
        return operator;
    }

    public Expression left() {
        return left;
    }

    public Expression right() {
        return right;
    }

    public boolean strict() {
        return strict;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.BINARY;
    }
}
