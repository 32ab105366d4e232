package work.lcod.liquid.runtime;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.ast.AssignStatement;
import work.lcod.liquid.ast.BinaryExpression;
import work.lcod.liquid.ast.CaptureStatement;
import work.lcod.liquid.ast.CustomExpression;
import work.lcod.liquid.ast.CustomStatement;
import work.lcod.liquid.ast.ArgumentExpression;
import work.lcod.liquid.ast.Expression;
import work.lcod.liquid.ast.FilterExpression;
import work.lcod.liquid.ast.ForStatement;
import work.lcod.liquid.ast.FunctionCallSegment;
import work.lcod.liquid.ast.IdentifierSegment;
import work.lcod.liquid.ast.IfStatement;
import work.lcod.liquid.ast.IndexerSegment;
import work.lcod.liquid.ast.LiteralExpression;
import work.lcod.liquid.ast.MacroStatement;
import work.lcod.liquid.ast.MemberExpression;
import work.lcod.liquid.ast.MemberSegment;
import work.lcod.liquid.ast.OutputStatement;
import work.lcod.liquid.ast.RangeExpression;
import work.lcod.liquid.ast.Statement;
import work.lcod.liquid.ast.TextSpanStatement;
import work.lcod.liquid.flow.AsyncFlow;
import work.lcod.liquid.flow.Completion;
import work.lcod.liquid.flow.MalformedTemplateException;
import work.lcod.liquid.text.Sinks;
import work.lcod.liquid.text.TextEncoder;
import work.lcod.liquid.values.Arguments;
import work.lcod.liquid.values.ForLoopValue;
import work.lcod.liquid.values.FunctionValue;
import work.lcod.liquid.values.StringValue;
import work.lcod.liquid.values.Value;
import work.lcod.liquid.values.Values;

/**
 * Walks a template tree. Every statement and expression evaluates to a future; futures that are
 * already complete are consumed synchronously so a render only suspends where a filter, a
 * function or an enumeration actually does.
 */
public final class TemplateInterpreter {
    public static final String FOR_LOOP = "forloop";

    private TemplateInterpreter() {}

    public static CompletableFuture<Void> render(List<Statement> statements, TemplateContext context, Writer writer, TextEncoder encoder) {
        return runBody(statements, writer, encoder, context).thenApply(completion -> {
            Sinks.flush(writer);
            return null;
        });
    }

    public static CompletableFuture<Completion> runBody(List<Statement> body, Writer writer, TextEncoder encoder, TemplateContext context) {
        return AsyncFlow.sequence(body.size(), index -> execute(body.get(index), writer, encoder, context));
    }

    public static CompletableFuture<Completion> execute(Statement statement, Writer writer, TextEncoder encoder, TemplateContext context) {
        return AsyncFlow.guard(() -> switch (statement.kind()) {
            case TEXT_SPAN -> writeText((TextSpanStatement) statement, writer, context);
            case OUTPUT -> writeOutput((OutputStatement) statement, writer, encoder, context);
            case FOR -> runFor((ForStatement) statement, writer, encoder, context);
            case IF -> runIf((IfStatement) statement, writer, encoder, context);
            case MACRO -> defineMacro((MacroStatement) statement, encoder, context);
            case BREAK -> signal(Completion.BREAK, context);
            case CONTINUE -> signal(Completion.CONTINUE, context);
            case ASSIGN -> assign((AssignStatement) statement, context);
            case CAPTURE -> capture((CaptureStatement) statement, encoder, context);
            case COMMENT -> AsyncFlow.normal();
            case CUSTOM -> {
                context.incrementSteps();
                yield ((CustomStatement) statement).writeToAsync(writer, encoder, context);
            }
        });
    }

    public static CompletableFuture<Value> evaluate(Expression expression, TemplateContext context) {
        return AsyncFlow.guard(() -> switch (expression.kind()) {
            case LITERAL -> Values.completed(((LiteralExpression) expression).value());
            case MEMBER -> evaluateMember((MemberExpression) expression, context);
            case RANGE -> evaluateRange((RangeExpression) expression, context);
            case FILTER -> evaluateFilter((FilterExpression) expression, context);
            case BINARY -> evaluateBinary((BinaryExpression) expression, context);
            case CUSTOM -> ((CustomExpression) expression).evaluateAsync(context);
        });
    }

    /**
     * Writes a value through the encoder using the render locale.
     */
    public static void writeValue(Value value, Writer writer, TextEncoder encoder, TemplateContext context) {
        try {
            value.writeTo(writer, encoder, context.options().locale());
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private static CompletableFuture<Completion> writeText(TextSpanStatement span, Writer writer, TemplateContext context) {
        var text = span.resolve(context.options().trimming());
        if (text.isEmpty()) {
            return AsyncFlow.normal();
        }
        context.incrementSteps();
        Sinks.write(writer, text);
        return AsyncFlow.normal();
    }

    private static CompletableFuture<Completion> writeOutput(OutputStatement output, Writer writer, TextEncoder encoder, TemplateContext context) {
        context.incrementSteps();
        return evaluate(output.expression(), context).thenApply(value -> {
            writeValue(value, writer, encoder, context);
            return Completion.NORMAL;
        });
    }

    private static CompletableFuture<Completion> signal(Completion completion, TemplateContext context) {
        context.incrementSteps();
        return AsyncFlow.completedWith(completion);
    }

    private static CompletableFuture<Completion> runFor(ForStatement loop, Writer writer, TextEncoder encoder, TemplateContext context) {
        context.incrementSteps();
        return evaluate(loop.source(), context)
            .thenCompose(source -> source.enumerateAsync(context))
            .thenCompose(items -> evaluateOptional(loop.limit(), context)
                .thenCompose(limit -> evaluateOptional(loop.offset(), context)
                    .thenCompose(offset -> {
                        var window = LoopWindow.apply(items, offset, limit, loop.reversed());
                        if (window.isEmpty()) {
                            return runBody(loop.elseBody(), writer, encoder, context);
                        }
                        return iterate(loop, window, writer, encoder, context);
                    })));
    }

    private static CompletableFuture<Completion> iterate(ForStatement loop, List<Value> items, Writer writer, TextEncoder encoder, TemplateContext context) {
        var lease = context.enterChildScope();
        int length = items.size();
        CompletableFuture<Completion> result = AsyncFlow.loop(length, index -> {
            context.incrementSteps();
            context.setValue(loop.identifier(), items.get(index));
            context.setValue(FOR_LOOP, new ForLoopValue(index, length));
            return runBody(loop.body(), writer, encoder, context);
        });
        return result.whenComplete((completion, error) -> lease.close());
    }

    private static CompletableFuture<Value> evaluateOptional(Expression expression, TemplateContext context) {
        return expression == null ? CompletableFuture.<Value>completedFuture(null) : evaluate(expression, context);
    }

    private static CompletableFuture<Completion> runIf(IfStatement statement, Writer writer, TextEncoder encoder, TemplateContext context) {
        context.incrementSteps();
        return evaluate(statement.condition(), context).thenCompose(condition -> {
            if (condition.toBooleanValue()) {
                return runBody(statement.body(), writer, encoder, context);
            }
            return runElseIf(statement, 0, writer, encoder, context);
        });
    }

    private static CompletableFuture<Completion> runElseIf(IfStatement statement, int index, Writer writer, TextEncoder encoder, TemplateContext context) {
        if (index >= statement.elseIfs().size()) {
            return runBody(statement.elseBody(), writer, encoder, context);
        }
        var branch = statement.elseIfs().get(index);
        return evaluate(branch.condition(), context).thenCompose(condition -> condition.toBooleanValue()
            ? runBody(branch.body(), writer, encoder, context)
            : runElseIf(statement, index + 1, writer, encoder, context));
    }

    private static CompletableFuture<Completion> defineMacro(MacroStatement macro, TextEncoder encoder, TemplateContext context) {
        context.incrementSteps();
        context.setValue(macro.identifier(), new FunctionValue((arguments, callContext) -> invokeMacro(macro, arguments, encoder, callContext)));
        return AsyncFlow.normal();
    }

    private static CompletableFuture<Value> invokeMacro(MacroStatement macro, Arguments arguments, TextEncoder encoder, TemplateContext context) {
        var lease = context.enterChildScope();
        var parameters = macro.parameters();
        var buffer = new StringWriter();
        CompletableFuture<Value> result = AsyncFlow.sequence(parameters.size(), index -> {
                var parameter = parameters.get(index);
                return bindParameter(parameter.name(), parameter.defaultValue(), index, arguments, context)
                    .thenApply(value -> {
                        context.setValue(parameter.name(), value);
                        return Completion.NORMAL;
                    });
            })
            .thenCompose(ignored -> runBody(macro.body(), buffer, encoder, context))
            .thenApply(completion -> new StringValue(buffer.toString(), false));
        return result.whenComplete((value, error) -> lease.close());
    }

    /**
     * Named argument, then positional argument at the parameter's index, then the default, then
     * Nil.
     */
    static CompletableFuture<Value> bindParameter(String name, Expression defaultValue, int index, Arguments arguments, TemplateContext context) {
        if (arguments.has(name)) {
            return Values.completed(arguments.get(name));
        }
        if (index < arguments.positionalCount()) {
            return Values.completed(arguments.positional(index));
        }
        if (defaultValue != null) {
            return evaluate(defaultValue, context);
        }
        return Values.nil();
    }

    private static CompletableFuture<Completion> assign(AssignStatement statement, TemplateContext context) {
        context.incrementSteps();
        return evaluate(statement.value(), context).thenApply(value -> {
            context.setValue(statement.identifier(), value);
            return Completion.NORMAL;
        });
    }

    private static CompletableFuture<Completion> capture(CaptureStatement statement, TextEncoder encoder, TemplateContext context) {
        context.incrementSteps();
        var buffer = new StringWriter();
        return runBody(statement.body(), buffer, encoder, context).thenApply(completion -> {
            context.setValue(statement.identifier(), new StringValue(buffer.toString(), false));
            return completion;
        });
    }

    private static CompletableFuture<Value> evaluateMember(MemberExpression member, TemplateContext context) {
        var root = member.rootIdentifier();
        if (root == null) {
            throw new MalformedTemplateException("A member expression must start with an identifier");
        }
        return resolveSegments(context.getValue(root), member.segments(), 1, context);
    }

    /**
     * Applies {@code segments[start..]} to {@code current}, looping while each step completes
     * synchronously.
     */
    public static CompletableFuture<Value> resolveSegments(Value current, List<MemberSegment> segments, int start, TemplateContext context) {
        var value = current;
        for (int index = start; index < segments.size(); index++) {
            var pending = applySegment(value, segments.get(index), context);
            if (AsyncFlow.isCompletedNormally(pending)) {
                value = pending.join();
                continue;
            }
            int next = index + 1;
            return pending.thenCompose(resolved -> resolveSegments(resolved, segments, next, context));
        }
        return Values.completed(value);
    }

    private static CompletableFuture<Value> applySegment(Value target, MemberSegment segment, TemplateContext context) {
        return AsyncFlow.guard(() -> switch (segment.kind()) {
            case IDENTIFIER -> target.getValueAsync(((IdentifierSegment) segment).identifier(), context);
            case INDEXER -> evaluate(((IndexerSegment) segment).index(), context)
                .thenCompose(index -> target.getIndexAsync(index, context));
            case CALL -> evaluateArguments(((FunctionCallSegment) segment).arguments(), context)
                .thenCompose(arguments -> target.invokeAsync(arguments, context));
        });
    }

    public static CompletableFuture<Arguments> evaluateArguments(List<ArgumentExpression> arguments, TemplateContext context) {
        if (arguments.isEmpty()) {
            return CompletableFuture.completedFuture(Arguments.EMPTY);
        }
        return AsyncFlow.collect(arguments.size(), index -> evaluate(arguments.get(index).expression(), context))
            .thenApply(values -> {
                var builder = Arguments.builder();
                for (int i = 0; i < values.size(); i++) {
                    builder.add(arguments.get(i).name(), values.get(i));
                }
                return builder.build();
            });
    }

    private static CompletableFuture<Value> evaluateRange(RangeExpression range, TemplateContext context) {
        return evaluate(range.from(), context).thenCompose(from -> evaluate(range.to(), context)
            .thenApply(to -> (Value) Values.range(from, to)));
    }

    private static CompletableFuture<Value> evaluateFilter(FilterExpression filter, TemplateContext context) {
        return evaluate(filter.input(), context).thenCompose(input -> evaluateArguments(filter.arguments(), context)
            .thenCompose(arguments -> applyFilter(filter.name(), input, arguments, context)));
    }

    /**
     * Calls a registered filter; an unknown filter returns its input.
     */
    public static CompletableFuture<Value> applyFilter(String name, Value input, Arguments arguments, TemplateContext context) {
        var function = context.options().filters().get(name);
        if (function == null) {
            return Values.completed(input);
        }
        return AsyncFlow.guard(() -> function.invoke(input, arguments, context));
    }

    private static CompletableFuture<Value> evaluateBinary(BinaryExpression binary, TemplateContext context) {
        return evaluate(binary.left(), context).thenCompose(left -> evaluate(binary.right(), context)
            .thenCompose(right -> BinaryOperations.apply(binary.operator(), left, right, binary.strict(), context)));
    }
}
