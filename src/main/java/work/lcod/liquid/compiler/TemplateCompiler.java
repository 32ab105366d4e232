package work.lcod.liquid.compiler;

import java.util.Objects;
import work.lcod.liquid.runtime.InterpretedTemplate;
import work.lcod.liquid.runtime.TemplateOptions;

/**
 * Lowers a template tree once into a reusable {@link CompiledTemplate}. Trimming, member access
 * and the message locale are taken from the options given here.
 */
public final class TemplateCompiler {
    private final TemplateOptions options;

    public TemplateCompiler() {
        this(TemplateOptions.defaults());
    }

    public TemplateCompiler(TemplateOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public TemplateOptions options() {
        return options;
    }

    public CompiledTemplate compile(InterpretedTemplate template) {
        return compile(template, null);
    }

    /**
     * Compiles {@code template}. When {@code modelType} is given, a second routine reads the
     * members of that type through typed accessors; it is used for renders whose model is an
     * instance of the type.
     *
     * @throws CompilationException when the template contains a construct that cannot be lowered
     */
    public CompiledTemplate compile(InterpretedTemplate template, Class<?> modelType) {
        Objects.requireNonNull(template, "template");
        var analysis = TemplateAnalysis.of(template.statements());
        var generic = lower(template, analysis, null);
        LoweredRoutine typed = null;
        if (ModelTypes.isObjectLike(modelType)) {
            var candidate = lower(template, analysis, modelType);
            if (!candidate.statistics().fastPathRoots().isEmpty()) {
                typed = candidate;
            }
        }
        return new CompiledTemplate(modelType, options, typed, generic);
    }

    private LoweredRoutine lower(InterpretedTemplate template, TemplateAnalysis analysis, Class<?> modelType) {
        var unit = new CompilationUnit(options, modelType, analysis);
        var statements = new StatementLowering(unit).lowerBody(template.statements(), LoweringScope.ROOT, true);
        return new LoweredRoutine(statements, unit.slotCount(), unit.macroCount(), unit.statistics());
    }
}
