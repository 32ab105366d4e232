package work.lcod.liquid.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.ast.ArgumentExpression;
import work.lcod.liquid.ast.BinaryExpression;
import work.lcod.liquid.ast.CustomExpression;
import work.lcod.liquid.ast.Expression;
import work.lcod.liquid.ast.FilterExpression;
import work.lcod.liquid.ast.FunctionCallSegment;
import work.lcod.liquid.ast.IdentifierSegment;
import work.lcod.liquid.ast.IndexerSegment;
import work.lcod.liquid.ast.LiteralExpression;
import work.lcod.liquid.ast.MemberExpression;
import work.lcod.liquid.ast.MemberSegment;
import work.lcod.liquid.ast.RangeExpression;
import work.lcod.liquid.ast.SegmentKind;
import work.lcod.liquid.flow.AsyncFlow;
import work.lcod.liquid.runtime.BinaryOperations;
import work.lcod.liquid.runtime.TemplateInterpreter;
import work.lcod.liquid.values.Arguments;
import work.lcod.liquid.values.Value;
import work.lcod.liquid.values.Values;

/**
 * Lowers expressions. Literal-only subtrees fold to constants, model members known to the
 * member-access strategy become typed accessor chains, everything else keeps the interpreter's
 * dynamic contract.
 */
final class ExpressionLowering {
    private final CompilationUnit unit;

    ExpressionLowering(CompilationUnit unit) {
        this.unit = unit;
    }

    LoweredExpression lower(Expression expression, LoweringScope scope) {
        return switch (expression.kind()) {
            case LITERAL -> unit.constant(((LiteralExpression) expression).value());
            case MEMBER -> lowerMember((MemberExpression) expression, scope);
            case RANGE -> lowerRange((RangeExpression) expression, scope);
            case FILTER -> lowerFilter((FilterExpression) expression, scope);
            case BINARY -> lowerBinary((BinaryExpression) expression, scope);
            case CUSTOM -> throw CompilationException.unsupportedExpression(((CustomExpression) expression).name(), unit.locale());
        };
    }

    ValueEvaluator lowerValue(Expression expression, LoweringScope scope) {
        return lower(expression, scope).asValue();
    }

    private LoweredExpression lowerRange(RangeExpression range, LoweringScope scope) {
        var from = lower(range.from(), scope);
        var to = lower(range.to(), scope);
        if (from.isConstant() && to.isConstant()) {
            return unit.constant(Values.range(from.constantValue(), to.constantValue()));
        }
        var fromValue = from.asValue();
        var toValue = to.asValue();
        return LoweredExpression.value(frame -> fromValue.evaluate(frame)
            .thenCompose(start -> toValue.evaluate(frame).thenApply(end -> (Value) Values.range(start, end))));
    }

    private LoweredExpression lowerBinary(BinaryExpression binary, LoweringScope scope) {
        var left = lower(binary.left(), scope);
        var right = lower(binary.right(), scope);
        if (left.isConstant() && right.isConstant()
            && TemplateAnalysis.isFoldable(left.constantValue().kind())
            && TemplateAnalysis.isFoldable(right.constantValue().kind())) {
            var folded = BinaryOperations.apply(binary.operator(), left.constantValue(), right.constantValue(), binary.strict(), null);
            if (AsyncFlow.isCompletedNormally(folded)) {
                return unit.constant(folded.join());
            }
        }
        var leftValue = left.asValue();
        var rightValue = right.asValue();
        var operator = binary.operator();
        boolean strict = binary.strict();
        return LoweredExpression.value(frame -> leftValue.evaluate(frame)
            .thenCompose(l -> rightValue.evaluate(frame)
                .thenCompose(r -> BinaryOperations.apply(operator, l, r, strict, frame.context()))));
    }

    private LoweredExpression lowerFilter(FilterExpression filter, LoweringScope scope) {
        var input = lowerValue(filter.input(), scope);
        var arguments = stage(filter.arguments(), scope);
        var name = filter.name();
        return LoweredExpression.value(frame -> input.evaluate(frame)
            .thenCompose(value -> arguments.stage(frame)
                .thenCompose(bundle -> TemplateInterpreter.applyFilter(name, value, bundle, frame.context()))));
    }

    /**
     * Builds the argument bundle once when every argument is a constant, otherwise evaluates
     * the arguments in order on each call.
     */
    ArgumentStager stage(List<ArgumentExpression> arguments, LoweringScope scope) {
        if (arguments.isEmpty()) {
            var empty = CompletableFuture.completedFuture(Arguments.EMPTY);
            return frame -> empty;
        }
        var lowered = new ArrayList<LoweredExpression>(arguments.size());
        boolean constant = true;
        for (var argument : arguments) {
            var expression = lower(argument.expression(), scope);
            constant &= expression.isConstant();
            lowered.add(expression);
        }
        if (constant) {
            var builder = Arguments.builder();
            for (int i = 0; i < arguments.size(); i++) {
                builder.add(arguments.get(i).name(), lowered.get(i).constantValue());
            }
            var bundle = CompletableFuture.completedFuture(builder.build());
            unit.recordCachedBundle();
            return frame -> bundle;
        }
        var evaluators = new ArrayList<ValueEvaluator>(lowered.size());
        for (var expression : lowered) {
            evaluators.add(expression.asValue());
        }
        return frame -> AsyncFlow.collect(evaluators.size(), index -> evaluators.get(index).evaluate(frame))
            .thenApply(values -> {
                var builder = Arguments.builder();
                for (int i = 0; i < values.size(); i++) {
                    builder.add(arguments.get(i).name(), values.get(i));
                }
                return builder.build();
            });
    }

    private LoweredExpression lowerMember(MemberExpression member, LoweringScope scope) {
        var root = member.rootIdentifier();
        if (root == null) {
            throw CompilationException.malformedMember(describe(member), unit.locale());
        }
        var segments = member.segments();
        var head = lowerRoot(root, scope);
        int next = 1;
        while (next < segments.size()
            && head.form() == LoweredExpression.Form.MODEL
            && segments.get(next) instanceof IdentifierSegment identifier) {
            var accessor = unit.member(head.type(), identifier.identifier());
            if (accessor == null) {
                break;
            }
            var owner = head.modelEvaluator();
            head = LoweredExpression.model(frame -> {
                var target = owner.read(frame);
                return target == null ? null : accessor.get(target);
            }, accessor.type(), accessor.elementType());
            next++;
        }
        if (next == segments.size()) {
            return head;
        }
        var remaining = lowerSegments(segments.subList(next, segments.size()), scope);
        var base = head.asValue();
        return LoweredExpression.value(frame -> base.evaluate(frame)
            .thenCompose(value -> resolve(value, remaining, 0, frame)));
    }

    private LoweredExpression lowerRoot(String root, LoweringScope scope) {
        var symbol = scope.lookup(root);
        if (symbol != null) {
            return switch (symbol.kind()) {
                case STATIC_CONSTANT -> LoweredExpression.constant(symbol.constant());
                case MODEL_LOCAL -> {
                    int slot = symbol.slot();
                    yield LoweredExpression.model(frame -> frame.slots()[slot], symbol.type(), symbol.elementType());
                }
                case MACRO -> {
                    int slot = symbol.slot();
                    yield LoweredExpression.value(frame -> {
                        var function = frame.macros()[slot];
                        return Values.completed(function != null ? function : frame.context().getValue(root));
                    });
                }
                case VALUE_LOCAL -> dynamicRoot(root);
            };
        }
        var accessor = unit.modelRoot(root);
        if (accessor != null) {
            return LoweredExpression.model(frame -> accessor.get(frame.model()), accessor.type(), accessor.elementType());
        }
        return dynamicRoot(root);
    }

    private static LoweredExpression dynamicRoot(String root) {
        return LoweredExpression.value(frame -> Values.completed(frame.context().getValue(root)));
    }

    private List<LoweredSegment> lowerSegments(List<MemberSegment> segments, LoweringScope scope) {
        var lowered = new ArrayList<LoweredSegment>(segments.size());
        for (var segment : segments) {
            lowered.add(switch (segment.kind()) {
                case IDENTIFIER -> LoweredSegment.identifier(((IdentifierSegment) segment).identifier());
                case INDEXER -> LoweredSegment.indexer(lowerValue(((IndexerSegment) segment).index(), scope));
                case CALL -> LoweredSegment.call(stage(((FunctionCallSegment) segment).arguments(), scope));
            });
        }
        return List.copyOf(lowered);
    }

    private static CompletableFuture<Value> resolve(Value current, List<LoweredSegment> segments, int start, RenderFrame frame) {
        var value = current;
        for (int index = start; index < segments.size(); index++) {
            var pending = apply(value, segments.get(index), frame);
            if (AsyncFlow.isCompletedNormally(pending)) {
                value = pending.join();
                continue;
            }
            int next = index + 1;
            return pending.thenCompose(resolved -> resolve(resolved, segments, next, frame));
        }
        return Values.completed(value);
    }

    private static CompletableFuture<Value> apply(Value target, LoweredSegment segment, RenderFrame frame) {
        var context = frame.context();
        return AsyncFlow.guard(() -> switch (segment.kind()) {
            case IDENTIFIER -> target.getValueAsync(segment.name(), context);
            case INDEXER -> segment.index().evaluate(frame).thenCompose(index -> target.getIndexAsync(index, context));
            case CALL -> segment.arguments().stage(frame).thenCompose(arguments -> target.invokeAsync(arguments, context));
        });
    }

    private static String describe(MemberExpression member) {
        var builder = new StringBuilder();
        for (var segment : member.segments()) {
            switch (segment.kind()) {
                case IDENTIFIER -> builder.append('.').append(((IdentifierSegment) segment).identifier());
                case INDEXER -> builder.append("[]");
                case CALL -> builder.append("()");
            }
        }
        return builder.length() == 0 ? "<empty>" : builder.toString();
    }

    private record LoweredSegment(SegmentKind kind, String name, ValueEvaluator index, ArgumentStager arguments) {
        static LoweredSegment identifier(String name) {
            return new LoweredSegment(SegmentKind.IDENTIFIER, name, null, null);
        }

        static LoweredSegment indexer(ValueEvaluator index) {
            return new LoweredSegment(SegmentKind.INDEXER, null, index, null);
        }

        static LoweredSegment call(ArgumentStager arguments) {
            return new LoweredSegment(SegmentKind.CALL, null, null, arguments);
        }
    }
}
