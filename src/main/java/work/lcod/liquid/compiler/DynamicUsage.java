package work.lcod.liquid.compiler;

import java.util.List;
import work.lcod.liquid.ast.BinaryExpression;
import work.lcod.liquid.ast.Expression;
import work.lcod.liquid.ast.ForStatement;
import work.lcod.liquid.ast.IfStatement;
import work.lcod.liquid.ast.IndexerSegment;
import work.lcod.liquid.ast.MemberExpression;
import work.lcod.liquid.ast.OutputStatement;
import work.lcod.liquid.ast.RangeExpression;
import work.lcod.liquid.ast.SegmentKind;
import work.lcod.liquid.ast.Statement;
import work.lcod.liquid.runtime.TemplateInterpreter;

/**
 * Decides whether a loop body may observe the context's scope frames, in which case a
 * model-typed loop still binds its variable and {@code forloop} in a pushed scope.
 */
final class DynamicUsage {
    private DynamicUsage() {}

    static boolean requiresScope(List<Statement> body) {
        for (var statement : body) {
            if (requiresScope(statement)) {
                return true;
            }
        }
        return false;
    }

    private static boolean requiresScope(Statement statement) {
        return switch (statement.kind()) {
            case ASSIGN, CAPTURE, MACRO, CUSTOM -> true;
            case TEXT_SPAN, BREAK, CONTINUE, COMMENT -> false;
            case OUTPUT -> requiresScope(((OutputStatement) statement).expression());
            case FOR -> {
                var loop = (ForStatement) statement;
                yield requiresScope(loop.source())
                    || (loop.limit() != null && requiresScope(loop.limit()))
                    || (loop.offset() != null && requiresScope(loop.offset()))
                    || requiresScope(loop.body())
                    || requiresScope(loop.elseBody());
            }
            case IF -> {
                var branch = (IfStatement) statement;
                boolean dynamic = requiresScope(branch.condition()) || requiresScope(branch.body()) || requiresScope(branch.elseBody());
                for (var elseIf : branch.elseIfs()) {
                    dynamic = dynamic || requiresScope(elseIf.condition()) || requiresScope(elseIf.body());
                }
                yield dynamic;
            }
        };
    }

    private static boolean requiresScope(Expression expression) {
        return switch (expression.kind()) {
            case LITERAL -> false;
            case FILTER, CUSTOM -> true;
            case RANGE -> {
                var range = (RangeExpression) expression;
                yield requiresScope(range.from()) || requiresScope(range.to());
            }
            case BINARY -> {
                var binary = (BinaryExpression) expression;
                yield requiresScope(binary.left()) || requiresScope(binary.right());
            }
            case MEMBER -> requiresScope((MemberExpression) expression);
        };
    }

    private static boolean requiresScope(MemberExpression member) {
        if (TemplateInterpreter.FOR_LOOP.equals(member.rootIdentifier())) {
            return true;
        }
        for (var segment : member.segments()) {
            if (segment.kind() == SegmentKind.CALL) {
                return true;
            }
            if (segment instanceof IndexerSegment indexer && requiresScope(indexer.index())) {
                return true;
            }
        }
        return false;
    }
}
