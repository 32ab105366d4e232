package work.lcod.liquid.runtime;

import java.util.Objects;
import work.lcod.liquid.flow.RecursionLimitExceededException;
import work.lcod.liquid.flow.RenderCancelledException;
import work.lcod.liquid.flow.StepLimitExceededException;
import work.lcod.liquid.values.NilValue;
import work.lcod.liquid.values.ObjectValue;
import work.lcod.liquid.values.Value;
import work.lcod.liquid.values.Values;

/**
 * Per-render state: scope stack, model, options, step counter and cancellation token. A context
 * belongs to a single render and is not shared between threads.
 */
public final class TemplateContext {
    private final Object model;
    private final TemplateOptions options;
    private final CancellationToken cancellationToken;
    private final Scope root = new Scope(null);
    private Scope current = root;
    private Value modelValue;
    private long steps;

    public TemplateContext() {
        this(null, TemplateOptions.defaults(), new CancellationToken());
    }

    public TemplateContext(Object model) {
        this(model, TemplateOptions.defaults(), new CancellationToken());
    }

    public TemplateContext(Object model, TemplateOptions options) {
        this(model, options, new CancellationToken());
    }

    public TemplateContext(Object model, TemplateOptions options, CancellationToken token) {
        this.model = model;
        this.options = Objects.requireNonNull(options, "options");
        this.cancellationToken = token == null ? new CancellationToken() : token;
    }

    public Object model() {
        return model;
    }

    public TemplateOptions options() {
        return options;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    /**
     * Resolves a name through the scope frames, innermost first, then through the model.
     * Unknown names resolve to Nil.
     */
    public Value getValue(String name) {
        var value = current.find(name);
        if (value != null) {
            return value;
        }
        if (model == null) {
            return NilValue.INSTANCE;
        }
        if (modelValue == null) {
            modelValue = Values.create(model, options);
        }
        if (modelValue instanceof ObjectValue object) {
            return object.getMember(name, options);
        }
        return NilValue.INSTANCE;
    }

    /**
     * Whether a scope frame binds {@code name}; the model is not consulted.
     */
    public boolean hasValue(String name) {
        return current.find(name) != null;
    }

    public TemplateContext setValue(String name, Value value) {
        current.set(name, value == null ? NilValue.INSTANCE : value);
        return this;
    }

    public TemplateContext setValue(String name, Object value) {
        return setValue(name, Values.create(value, options));
    }

    /**
     * Pushes a scope frame, failing once the nesting would exceed {@code maxRecursion}.
     */
    public ScopeLease enterChildScope() {
        int max = options.maxRecursion();
        if (max > 0 && current.depth() >= max) {
            throw new RecursionLimitExceededException(max);
        }
        current = new Scope(current);
        return new ScopeLease(this, current);
    }

    /**
     * Pops the innermost frame.
     */
    public void releaseScope() {
        if (current == root) {
            throw new IllegalStateException("Cannot release the root scope");
        }
        current = current.parent();
    }

    void release(Scope scope) {
        if (current != scope) {
            throw new IllegalStateException("Scopes released out of order");
        }
        releaseScope();
    }

    public int scopeDepth() {
        return current.depth();
    }

    public void incrementSteps() {
        ensureNotCancelled();
        steps++;
        long max = options.maxSteps();
        if (max > 0 && steps > max) {
            throw new StepLimitExceededException(max);
        }
    }

    public long steps() {
        return steps;
    }

    public void ensureNotCancelled() {
        if (cancellationToken.isCancelled()) {
            throw new RenderCancelledException("Render cancelled");
        }
    }

    public void cancel() {
        cancellationToken.cancel();
    }

    public static final class CancellationToken {
        private volatile boolean cancelled = false;

        public void cancel() {
            this.cancelled = true;
        }

        public boolean isCancelled() {
            return cancelled;
        }
    }
}
