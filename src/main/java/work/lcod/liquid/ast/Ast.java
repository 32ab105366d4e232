package work.lcod.liquid.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import work.lcod.liquid.text.Adjacent;
import work.lcod.liquid.values.BlankValue;
import work.lcod.liquid.values.EmptyValue;
import work.lcod.liquid.values.NilValue;
import work.lcod.liquid.values.Values;

/**
 * Factory helpers for building trees in code, and the neighbour linking applied to every body.
 */
public final class Ast {
    private Ast() {}

    /**
     * Links a body nested inside a tag: its first and last text spans sit next to that tag.
     */
    public static List<Statement> linkBody(List<Statement> body) {
        return link(body, Adjacent.TAG, Adjacent.TAG);
    }

    /**
     * Returns an immutable copy of {@code statements} where every text span knows what kind of
     * statement sits on each side of it.
     */
    public static List<Statement> link(List<Statement> statements, Adjacent before, Adjacent after) {
        if (statements == null || statements.isEmpty()) {
            return List.of();
        }
        var linked = new ArrayList<Statement>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            var statement = statements.get(i);
            if (statement instanceof TextSpanStatement span) {
                var previous = i == 0 ? before : statements.get(i - 1).adjacency();
                var next = i == statements.size() - 1 ? after : statements.get(i + 1).adjacency();
                linked.add(span.withNeighbours(previous, next));
            } else {
                linked.add(statement);
            }
        }
        return List.copyOf(linked);
    }

    public static List<Statement> body(Statement... statements) {
        return Arrays.asList(statements);
    }

    public static TextSpanStatement text(String text) {
        return new TextSpanStatement(text);
    }

    public static TextSpanStatement text(String text, boolean stripLeft, boolean stripRight) {
        return new TextSpanStatement(text, stripLeft, stripRight);
    }

    public static OutputStatement output(Expression expression) {
        return new OutputStatement(expression);
    }

    public static AssignStatement assign(String identifier, Expression value) {
        return new AssignStatement(identifier, value);
    }

    public static ForStatement forLoop(String identifier, Expression source, Statement... body) {
        return new ForStatement(identifier, source, Arrays.asList(body));
    }

    public static IfStatement ifThen(Expression condition, Statement... body) {
        return new IfStatement(condition, Arrays.asList(body));
    }

    public static LiteralExpression literal(Object value) {
        return new LiteralExpression(Values.create(value, null));
    }

    public static LiteralExpression nil() {
        return new LiteralExpression(NilValue.INSTANCE);
    }

    public static LiteralExpression blank() {
        return new LiteralExpression(BlankValue.INSTANCE);
    }

    public static LiteralExpression empty() {
        return new LiteralExpression(EmptyValue.INSTANCE);
    }

    /**
     * A plain dotted path such as {@code member("user", "name")}.
     */
    public static MemberExpression member(String... path) {
        var segments = new ArrayList<MemberSegment>(path.length);
        for (var name : path) {
            segments.add(new IdentifierSegment(name));
        }
        return new MemberExpression(segments);
    }

    public static MemberExpression member(MemberSegment... segments) {
        return new MemberExpression(Arrays.asList(segments));
    }

    public static IdentifierSegment identifier(String name) {
        return new IdentifierSegment(name);
    }

    public static IndexerSegment index(Expression index) {
        return new IndexerSegment(index);
    }

    public static FunctionCallSegment call(ArgumentExpression... arguments) {
        return new FunctionCallSegment(Arrays.asList(arguments));
    }

    public static RangeExpression range(Expression from, Expression to) {
        return new RangeExpression(from, to);
    }

    public static FilterExpression filter(Expression input, String name, ArgumentExpression... arguments) {
        return new FilterExpression(input, name, Arrays.asList(arguments));
    }

    public static ArgumentExpression arg(Expression expression) {
        return ArgumentExpression.positional(expression);
    }

    public static ArgumentExpression arg(String name, Expression expression) {
        return ArgumentExpression.named(name, expression);
    }

    public static BinaryExpression binary(BinaryOperator operator, Expression left, Expression right) {
        return new BinaryExpression(operator, left, right);
    }
}
