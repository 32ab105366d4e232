package work.lcod.liquid.compiler;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import work.lcod.liquid.runtime.MemberAccessor;
import work.lcod.liquid.runtime.TemplateOptions;
import work.lcod.liquid.values.Value;

/**
 * Mutable state of one lowering pass: slot allocation and statistics.
 */
final class CompilationUnit {
    private final TemplateOptions options;
    private final Class<?> modelType;
    private final TemplateAnalysis analysis;
    private final Set<String> fastPathRoots = new TreeSet<>();
    private int slots;
    private int macros;
    private int constants;
    private int cachedArgumentBundles;

    CompilationUnit(TemplateOptions options, Class<?> modelType, TemplateAnalysis analysis) {
        this.options = options;
        this.modelType = modelType;
        this.analysis = analysis;
    }

    TemplateOptions options() {
        return options;
    }

    TemplateAnalysis analysis() {
        return analysis;
    }

    Locale locale() {
        return options.locale();
    }

    int allocateSlot() {
        return slots++;
    }

    int allocateMacro() {
        return macros++;
    }

    int slotCount() {
        return slots;
    }

    int macroCount() {
        return macros;
    }

    LoweredExpression constant(Value value) {
        constants++;
        return LoweredExpression.constant(value);
    }

    void recordCachedBundle() {
        cachedArgumentBundles++;
    }

    /**
     * Accessor for a root name read straight from the model, or null when the name must be
     * resolved through the context. Names bound anywhere in the template never qualify.
     */
    MemberAccessor modelRoot(String name) {
        if (modelType == null || analysis.isBound(name)) {
            return null;
        }
        var accessor = options.memberAccessStrategy().getAccessor(modelType, name);
        if (accessor != null) {
            fastPathRoots.add(name);
        }
        return accessor;
    }

    MemberAccessor member(Class<?> owner, String name) {
        if (!ModelTypes.isObjectLike(owner)) {
            return null;
        }
        return options.memberAccessStrategy().getAccessor(owner, name);
    }

    CompilationStatistics statistics() {
        return new CompilationStatistics(constants, cachedArgumentBundles, macros, fastPathRoots);
    }
}
