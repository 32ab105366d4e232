package work.lcod.liquid.ast;

import java.util.Objects;
import work.lcod.liquid.text.Adjacent;

public final class OutputStatement extends Statement {
    private final Expression expression;

    public OutputStatement(Expression expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.OUTPUT;
    }

    @Override
    public Adjacent adjacency() {
        return Adjacent.OUTPUT;
    }
}
