package work.lcod.liquid.ast;

import java.util.List;
import java.util.Objects;

public final class IfStatement extends Statement {
    private final Expression condition;
    private final List<Statement> body;
    private final List<ElseIfBranch> elseIfs;
    private final List<Statement> elseBody;

    public IfStatement(Expression condition, List<Statement> body) {
        this(condition, body, List.of(), List.of());
    }

    public IfStatement(Expression condition, List<Statement> body, List<ElseIfBranch> elseIfs, List<Statement> elseBody) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.body = Ast.linkBody(body);
        this.elseIfs = elseIfs == null ? List.of() : List.copyOf(elseIfs);
        this.elseBody = Ast.linkBody(elseBody);
    }

    public Expression condition() {
        return condition;
    }

    public List<Statement> body() {
        return body;
    }

    public List<ElseIfBranch> elseIfs() {
        return elseIfs;
    }

    public List<Statement> elseBody() {
        return elseBody;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.IF;
    }
}
