package work.lcod.liquid.ast;

import java.util.Objects;

/**
 * A filter or call argument; {@code name} is null for positional arguments.
 */
public record ArgumentExpression(String name, Expression expression) {
    public ArgumentExpression {
        Objects.requireNonNull(expression, "expression");
        if (name != null && name.isEmpty()) {
            name = null;
        }
    }

    public static ArgumentExpression positional(Expression expression) {
        return new ArgumentExpression(null, expression);
    }

    public static ArgumentExpression named(String name, Expression expression) {
        return new ArgumentExpression(name, expression);
    }

    public boolean isNamed() {
        return name != null;
    }
}
