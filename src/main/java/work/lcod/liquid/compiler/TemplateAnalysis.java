package work.lcod.liquid.compiler;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.liquid.ast.AssignStatement;
import work.lcod.liquid.ast.BinaryExpression;
import work.lcod.liquid.ast.CaptureStatement;
import work.lcod.liquid.ast.Expression;
import work.lcod.liquid.ast.ForStatement;
import work.lcod.liquid.ast.IfStatement;
import work.lcod.liquid.ast.MacroStatement;
import work.lcod.liquid.ast.RangeExpression;
import work.lcod.liquid.ast.Statement;
import work.lcod.liquid.runtime.TemplateInterpreter;
import work.lcod.liquid.values.ValueKind;

/**
 * Whole-template pre-pass counting how many places bind each name. A name bound exactly once,
 * by a top-level {@code assign} of a literal-only expression, is a static constant.
 */
final class TemplateAnalysis {
    private final Map<String, Integer> bindings = new HashMap<>();
    private final Set<String> literalRootAssigns = new HashSet<>();

    private TemplateAnalysis() {}

    static TemplateAnalysis of(List<Statement> root) {
        var analysis = new TemplateAnalysis();
        analysis.visit(root, true);
        return analysis;
    }

    boolean isBound(String name) {
        return bindings.containsKey(name);
    }

    int bindingCount(String name) {
        return bindings.getOrDefault(name, 0);
    }

    boolean isStatic(String name) {
        return bindingCount(name) == 1 && literalRootAssigns.contains(name);
    }

    private void visit(List<Statement> body, boolean root) {
        for (var statement : body) {
            switch (statement.kind()) {
                case FOR -> {
                    var loop = (ForStatement) statement;
                    bind(loop.identifier());
                    bind(TemplateInterpreter.FOR_LOOP);
                    visit(loop.body(), false);
                    visit(loop.elseBody(), false);
                }
                case IF -> {
                    var branch = (IfStatement) statement;
                    visit(branch.body(), false);
                    for (var elseIf : branch.elseIfs()) {
                        visit(elseIf.body(), false);
                    }
                    visit(branch.elseBody(), false);
                }
                case MACRO -> {
                    var macro = (MacroStatement) statement;
                    bind(macro.identifier());
                    for (var parameter : macro.parameters()) {
                        bind(parameter.name());
                    }
                    visit(macro.body(), false);
                }
                case ASSIGN -> {
                    var assign = (AssignStatement) statement;
                    bind(assign.identifier());
                    if (root && isLiteralOnly(assign.value())) {
                        literalRootAssigns.add(assign.identifier());
                    }
                }
                case CAPTURE -> {
                    var capture = (CaptureStatement) statement;
                    bind(capture.identifier());
                    visit(capture.body(), false);
                }
                case TEXT_SPAN, OUTPUT, BREAK, CONTINUE, COMMENT, CUSTOM -> {
                }
            }
        }
    }

    private void bind(String name) {
        bindings.merge(name, 1, Integer::sum);
    }

    static boolean isLiteralOnly(Expression expression) {
        return switch (expression.kind()) {
            case LITERAL -> true;
            case RANGE -> {
                var range = (RangeExpression) expression;
                yield isLiteralOnly(range.from()) && isLiteralOnly(range.to());
            }
            case BINARY -> {
                var binary = (BinaryExpression) expression;
                yield isLiteralOnly(binary.left()) && isLiteralOnly(binary.right());
            }
            case MEMBER, FILTER, CUSTOM -> false;
        };
    }

    static boolean isFoldable(ValueKind kind) {
        return kind != ValueKind.OBJECT && kind != ValueKind.FUNCTION;
    }
}
