package work.lcod.liquid.ast;

import java.util.List;
import java.util.Objects;

public final class MacroStatement extends Statement {
    private final String identifier;
    private final List<MacroParameter> parameters;
    private final List<Statement> body;

    public MacroStatement(String identifier, List<MacroParameter> parameters, List<Statement> body) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.body = Ast.linkBody(body);
    }

    public String identifier() {
        return identifier;
    }

    public List<MacroParameter> parameters() {
        return parameters;
    }

    public List<Statement> body() {
        return body;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.MACRO;
    }
}
