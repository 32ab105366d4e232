package work.lcod.liquid.ast;

import java.util.List;
import java.util.Objects;

public record ElseIfBranch(Expression condition, List<Statement> body) {
    public ElseIfBranch {
        Objects.requireNonNull(condition, "condition");
        body = Ast.linkBody(body);
    }
}
