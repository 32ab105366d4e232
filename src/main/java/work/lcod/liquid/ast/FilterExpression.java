package work.lcod.liquid.ast;

import java.util.List;
import java.util.Objects;

public final class FilterExpression extends Expression {
    private final Expression input;
    private final String name;
    private final List<ArgumentExpression> arguments;

    public FilterExpression(Expression input, String name, List<ArgumentExpression> arguments) {
        this.input = Objects.requireNonNull(input, "input");
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public Expression input() {
        return input;
    }

    public String name() {
        return name;
    }

    public List<ArgumentExpression> arguments() {
        return arguments;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.FILTER;
    }
}
