package work.lcod.liquid.compiler;

import java.io.Writer;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.runtime.LiquidTemplate;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.runtime.TemplateOptions;
import work.lcod.liquid.text.Sinks;
import work.lcod.liquid.text.TextEncoder;
import work.lcod.liquid.values.Value;

/**
 * Lowered form of a template. Read-only after compilation and safe to render concurrently, each
 * render with its own context and writer.
 */
public final class CompiledTemplate implements LiquidTemplate {
    private final Class<?> modelType;
    private final TemplateOptions options;
    private final LoweredRoutine typed;
    private final LoweredRoutine generic;

    CompiledTemplate(Class<?> modelType, TemplateOptions options, LoweredRoutine typed, LoweredRoutine generic) {
        this.modelType = modelType;
        this.options = options;
        this.typed = typed;
        this.generic = generic;
    }

    public Class<?> modelType() {
        return modelType;
    }

    public CompilationStatistics statistics() {
        return typed != null ? typed.statistics() : generic.statistics();
    }

    /**
     * Whether a render with {@code context} takes the typed model routine: the model must be an
     * instance of the compiled type, member access must go through the compiled strategy and no
     * model member read directly may be shadowed by a context binding.
     */
    public boolean usesTypedRoutine(TemplateContext context) {
        if (typed == null || !modelType.isInstance(context.model())) {
            return false;
        }
        if (context.options().memberAccessStrategy() != options.memberAccessStrategy()) {
            return false;
        }
        for (var name : typed.statistics().fastPathRoots()) {
            if (context.hasValue(name)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public CompletableFuture<Void> renderAsync(Writer writer, TextEncoder encoder, TemplateContext context) {
        var routine = usesTypedRoutine(context) ? typed : generic;
        var frame = new RenderFrame(
            context,
            writer,
            encoder,
            context.model(),
            new Object[routine.slotCount()],
            new Value[routine.macroCount()]
        );
        return StatementLowering.run(routine.statements(), frame).thenApply(completion -> {
            Sinks.flush(writer);
            return null;
        });
    }
}
