package work.lcod.liquid.ast;

import java.util.List;
import java.util.Objects;

public final class CaptureStatement extends Statement {
    private final String identifier;
    private final List<Statement> body;

    public CaptureStatement(String identifier, List<Statement> body) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.body = Ast.linkBody(body);
    }

    public String identifier() {
        return identifier;
    }

    public List<Statement> body() {
        return body;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.CAPTURE;
    }
}
