package work.lcod.liquid.compiler;

import java.io.StringWriter;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.flow.AsyncFlow;
import work.lcod.liquid.flow.Completion;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.values.Arguments;
import work.lcod.liquid.values.StringValue;
import work.lcod.liquid.values.Value;
import work.lcod.liquid.values.Values;

/**
 * A macro body lowered once: parameter binding, body rendered into a private buffer, scope
 * released on every exit.
 */
final class MacroRoutine {
    private final List<String> parameters;
    private final List<ValueEvaluator> defaults;
    private final List<CompiledStatement> body;

    MacroRoutine(List<String> parameters, List<ValueEvaluator> defaults, List<CompiledStatement> body) {
        this.parameters = parameters;
        this.defaults = defaults;
        this.body = body;
    }

    CompletableFuture<Value> invoke(Arguments arguments, TemplateContext context, RenderFrame definingFrame) {
        var lease = context.enterChildScope();
        var buffer = new StringWriter();
        var frame = definingFrame.forMacro(context, buffer);
        CompletableFuture<Value> result = AsyncFlow.sequence(parameters.size(), index -> bind(index, arguments, frame)
                .thenApply(value -> {
                    context.setValue(parameters.get(index), value);
                    return Completion.NORMAL;
                }))
            .thenCompose(ignored -> StatementLowering.run(body, frame))
            .thenApply(completion -> new StringValue(buffer.toString(), false));
        return result.whenComplete((value, error) -> lease.close());
    }

    private CompletableFuture<Value> bind(int index, Arguments arguments, RenderFrame frame) {
        var name = parameters.get(index);
        if (arguments.has(name)) {
            return Values.completed(arguments.get(name));
        }
        if (index < arguments.positionalCount()) {
            return Values.completed(arguments.positional(index));
        }
        var fallback = defaults.get(index);
        return fallback == null ? Values.nil() : fallback.evaluate(frame);
    }
}
