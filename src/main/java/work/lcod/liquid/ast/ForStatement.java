package work.lcod.liquid.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code for identifier in source limit:.. offset:.. reversed}, with an optional else body run
 * when nothing is iterated. {@code limit} and {@code offset} are null when absent.
 */
public final class ForStatement extends Statement {
    private final String identifier;
    private final Expression source;
    private final List<Statement> body;
    private final List<Statement> elseBody;
    private final Expression limit;
    private final Expression offset;
    private final boolean reversed;

    public ForStatement(String identifier, Expression source, List<Statement> body) {
        this(identifier, source, body, List.of(), null, null, false);
    }

    public ForStatement(
        String identifier,
        Expression source,
        List<Statement> body,
        List<Statement> elseBody,
        Expression limit,
        Expression offset,
        boolean reversed
    ) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.source = Objects.requireNonNull(source, "source");
        this.body = Ast.linkBody(body);
        this.elseBody = Ast.linkBody(elseBody);
        this.limit = limit;
        this.offset = offset;
        this.reversed = reversed;
    }

    public String identifier() {
        return identifier;
    }

    public Expression source() {
        return source;
    }

    public List<Statement> body() {
        return body;
    }

    public List<Statement> elseBody() {
        return elseBody;
    }

    public Expression limit() {
        return limit;
    }

    public Expression offset() {
        return offset;
    }

    public boolean reversed() {
        return reversed;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.FOR;
    }
}
