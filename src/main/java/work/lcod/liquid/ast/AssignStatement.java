package work.lcod.liquid.ast;

import java.util.Objects;

public final class AssignStatement extends Statement {
    private final String identifier;
    private final Expression value;

    public AssignStatement(String identifier, Expression value) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String identifier() {
        return identifier;
    }

    public Expression value() {
        return value;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.ASSIGN;
    }
}
