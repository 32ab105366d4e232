package work.lcod.liquid.compiler;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.ast.AssignStatement;
import work.lcod.liquid.ast.CaptureStatement;
import work.lcod.liquid.ast.CustomStatement;
import work.lcod.liquid.ast.ForStatement;
import work.lcod.liquid.ast.IfStatement;
import work.lcod.liquid.ast.MacroStatement;
import work.lcod.liquid.ast.OutputStatement;
import work.lcod.liquid.ast.Statement;
import work.lcod.liquid.ast.TextSpanStatement;
import work.lcod.liquid.flow.AsyncFlow;
import work.lcod.liquid.flow.Completion;
import work.lcod.liquid.runtime.LoopWindow;
import work.lcod.liquid.runtime.TemplateInterpreter;
import work.lcod.liquid.text.Sinks;
import work.lcod.liquid.values.ForLoopValue;
import work.lcod.liquid.values.FunctionValue;
import work.lcod.liquid.values.StringValue;
import work.lcod.liquid.values.Value;
import work.lcod.liquid.values.Values;

/**
 * Lowers statements into closures. Steps are counted at the same points as the interpreter:
 * once per executed statement (comments and empty text excepted) and once per loop iteration.
 */
final class StatementLowering {
    private final CompilationUnit unit;
    private final ExpressionLowering expressions;

    StatementLowering(CompilationUnit unit) {
        this.unit = unit;
        this.expressions = new ExpressionLowering(unit);
    }

    static CompletableFuture<Completion> run(List<CompiledStatement> body, RenderFrame frame) {
        return AsyncFlow.sequence(body.size(), index -> body.get(index).execute(frame));
    }

    List<CompiledStatement> lowerBody(List<Statement> body, LoweringScope scope, boolean root) {
        var compiled = new ArrayList<CompiledStatement>(body.size());
        var current = scope;
        for (var statement : body) {
            switch (statement.kind()) {
                case TEXT_SPAN -> {
                    var text = ((TextSpanStatement) statement).resolve(unit.options().trimming());
                    if (!text.isEmpty()) {
                        compiled.add(frame -> {
                            frame.context().incrementSteps();
                            Sinks.write(frame.writer(), text);
                            return AsyncFlow.normal();
                        });
                    }
                }
                case COMMENT -> {
                }
                case OUTPUT -> compiled.add(lowerOutput((OutputStatement) statement, current));
                case FOR -> compiled.add(lowerFor((ForStatement) statement, current));
                case IF -> compiled.add(lowerIf((IfStatement) statement, current));
                case MACRO -> {
                    var macro = (MacroStatement) statement;
                    int slot = unit.allocateMacro();
                    compiled.add(lowerMacro(macro, current, slot));
                    if (unit.analysis().bindingCount(macro.identifier()) == 1) {
                        current = current.with(macro.identifier(), Symbol.macro(slot));
                    }
                }
                case BREAK -> compiled.add(signal(Completion.BREAK));
                case CONTINUE -> compiled.add(signal(Completion.CONTINUE));
                case ASSIGN -> {
                    var assign = (AssignStatement) statement;
                    var value = expressions.lower(assign.value(), current);
                    compiled.add(lowerAssign(assign.identifier(), value.asValue()));
                    if (root && value.isConstant() && unit.analysis().isStatic(assign.identifier())) {
                        current = current.with(assign.identifier(), Symbol.staticConstant(value.constantValue()));
                    }
                }
                case CAPTURE -> compiled.add(lowerCapture((CaptureStatement) statement, current));
                case CUSTOM -> throw CompilationException.unsupportedStatement(((CustomStatement) statement).name(), unit.locale());
            }
        }
        return Collections.unmodifiableList(compiled);
    }

    private static CompiledStatement signal(Completion completion) {
        return frame -> {
            frame.context().incrementSteps();
            return AsyncFlow.completedWith(completion);
        };
    }

    private CompiledStatement lowerOutput(OutputStatement output, LoweringScope scope) {
        var expression = expressions.lower(output.expression(), scope);
        return switch (expression.form()) {
            case CONSTANT -> {
                var constant = expression.constantValue();
                yield frame -> {
                    frame.context().incrementSteps();
                    TemplateInterpreter.writeValue(constant, frame.writer(), frame.encoder(), frame.context());
                    return AsyncFlow.normal();
                };
            }
            case MODEL -> {
                var model = expression.modelEvaluator();
                yield frame -> {
                    frame.context().incrementSteps();
                    ModelWriter.write(model.read(frame), frame);
                    return AsyncFlow.normal();
                };
            }
            case VALUE -> {
                var value = expression.asValue();
                yield frame -> {
                    frame.context().incrementSteps();
                    return value.evaluate(frame).thenApply(result -> {
                        TemplateInterpreter.writeValue(result, frame.writer(), frame.encoder(), frame.context());
                        return Completion.NORMAL;
                    });
                };
            }
        };
    }

    private CompiledStatement lowerIf(IfStatement statement, LoweringScope scope) {
        int branches = statement.elseIfs().size() + 1;
        var conditions = new ArrayList<ValueEvaluator>(branches);
        var bodies = new ArrayList<List<CompiledStatement>>(branches);
        conditions.add(expressions.lowerValue(statement.condition(), scope));
        bodies.add(lowerBody(statement.body(), scope, false));
        for (var elseIf : statement.elseIfs()) {
            conditions.add(expressions.lowerValue(elseIf.condition(), scope));
            bodies.add(lowerBody(elseIf.body(), scope, false));
        }
        var elseBody = lowerBody(statement.elseBody(), scope, false);
        return frame -> {
            frame.context().incrementSteps();
            return branch(conditions, bodies, elseBody, 0, frame);
        };
    }

    private static CompletableFuture<Completion> branch(
        List<ValueEvaluator> conditions,
        List<List<CompiledStatement>> bodies,
        List<CompiledStatement> elseBody,
        int index,
        RenderFrame frame
    ) {
        if (index >= conditions.size()) {
            return run(elseBody, frame);
        }
        return conditions.get(index).evaluate(frame).thenCompose(condition -> condition.toBooleanValue()
            ? run(bodies.get(index), frame)
            : branch(conditions, bodies, elseBody, index + 1, frame));
    }

    private CompiledStatement lowerAssign(String identifier, ValueEvaluator value) {
        return frame -> {
            frame.context().incrementSteps();
            return value.evaluate(frame).thenApply(result -> {
                frame.context().setValue(identifier, result);
                return Completion.NORMAL;
            });
        };
    }

    private CompiledStatement lowerCapture(CaptureStatement capture, LoweringScope scope) {
        var body = lowerBody(capture.body(), scope, false);
        var identifier = capture.identifier();
        return frame -> {
            frame.context().incrementSteps();
            var buffer = new StringWriter();
            return run(body, frame.withWriter(buffer)).thenApply(completion -> {
                frame.context().setValue(identifier, new StringValue(buffer.toString(), false));
                return completion;
            });
        };
    }

    private CompiledStatement lowerMacro(MacroStatement macro, LoweringScope scope, int slot) {
        var macroScope = scope.forMacro();
        var names = new ArrayList<String>(macro.parameters().size());
        var defaults = new ArrayList<ValueEvaluator>(macro.parameters().size());
        for (var parameter : macro.parameters()) {
            defaults.add(parameter.defaultValue() == null ? null : expressions.lowerValue(parameter.defaultValue(), macroScope));
            names.add(parameter.name());
            macroScope = macroScope.with(parameter.name(), Symbol.valueLocal());
        }
        var routine = new MacroRoutine(
            List.copyOf(names),
            Collections.unmodifiableList(defaults),
            lowerBody(macro.body(), macroScope, false)
        );
        var identifier = macro.identifier();
        return frame -> {
            frame.context().incrementSteps();
            var function = new FunctionValue((arguments, context) -> routine.invoke(arguments, context, frame));
            frame.macros()[slot] = function;
            frame.context().setValue(identifier, function);
            return AsyncFlow.normal();
        };
    }

    private CompiledStatement lowerFor(ForStatement loop, LoweringScope scope) {
        var source = expressions.lower(loop.source(), scope);
        var limit = loop.limit() == null ? null : expressions.lowerValue(loop.limit(), scope);
        var offset = loop.offset() == null ? null : expressions.lowerValue(loop.offset(), scope);
        var elseBody = lowerBody(loop.elseBody(), scope, false);
        var identifier = loop.identifier();
        boolean reversed = loop.reversed();

        if (source.form() == LoweredExpression.Form.MODEL
            && ModelTypes.isSequence(source.type())
            && source.elementType() != null
            && unit.analysis().bindingCount(identifier) == 1) {
            int slot = unit.allocateSlot();
            var body = lowerBody(loop.body(), scope.with(identifier, Symbol.modelLocal(slot, source.elementType(), null)), false);
            boolean bindScope = DynamicUsage.requiresScope(loop.body());
            var items = source.modelEvaluator();
            return frame -> {
                frame.context().incrementSteps();
                var raw = ModelTypes.items(items.read(frame));
                return window(raw, limit, offset, reversed, frame).thenCompose(window -> window.isEmpty()
                    ? run(elseBody, frame)
                    : iterateModel(window, identifier, slot, bindScope, body, frame));
            };
        }

        var body = lowerBody(loop.body(), scope.with(identifier, Symbol.valueLocal()), false);
        var values = source.asValue();
        return frame -> {
            frame.context().incrementSteps();
            return values.evaluate(frame)
                .thenCompose(value -> value.enumerateAsync(frame.context()))
                .thenCompose(items -> window(items, limit, offset, reversed, frame))
                .thenCompose(window -> window.isEmpty()
                    ? run(elseBody, frame)
                    : iterateValues(window, identifier, body, frame));
        };
    }

    private static <T> CompletableFuture<List<T>> window(List<T> items, ValueEvaluator limit, ValueEvaluator offset, boolean reversed, RenderFrame frame) {
        return optional(limit, frame).thenCompose(limitValue -> optional(offset, frame)
            .thenApply(offsetValue -> LoopWindow.apply(items, offsetValue, limitValue, reversed)));
    }

    private static CompletableFuture<Value> optional(ValueEvaluator evaluator, RenderFrame frame) {
        return evaluator == null ? CompletableFuture.<Value>completedFuture(null) : evaluator.evaluate(frame);
    }

    private static CompletableFuture<Completion> iterateValues(List<Value> items, String identifier, List<CompiledStatement> body, RenderFrame frame) {
        var context = frame.context();
        var lease = context.enterChildScope();
        int length = items.size();
        CompletableFuture<Completion> result = AsyncFlow.loop(length, index -> {
            context.incrementSteps();
            context.setValue(identifier, items.get(index));
            context.setValue(TemplateInterpreter.FOR_LOOP, new ForLoopValue(index, length));
            return run(body, frame);
        });
        return result.whenComplete((completion, error) -> lease.close());
    }

    private static CompletableFuture<Completion> iterateModel(
        List<Object> items,
        String identifier,
        int slot,
        boolean bindScope,
        List<CompiledStatement> body,
        RenderFrame frame
    ) {
        var context = frame.context();
        int length = items.size();
        if (!bindScope) {
            return AsyncFlow.loop(length, index -> {
                context.incrementSteps();
                frame.slots()[slot] = items.get(index);
                return run(body, frame);
            });
        }
        var lease = context.enterChildScope();
        CompletableFuture<Completion> result = AsyncFlow.loop(length, index -> {
            context.incrementSteps();
            var item = items.get(index);
            frame.slots()[slot] = item;
            context.setValue(identifier, Values.create(item, context.options()));
            context.setValue(TemplateInterpreter.FOR_LOOP, new ForLoopValue(index, length));
            return run(body, frame);
        });
        return result.whenComplete((completion, error) -> lease.close());
    }
}
