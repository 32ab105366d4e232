package work.lcod.liquid.runtime;

/**
 * Handle on a pushed scope. Closing it releases exactly that scope; closing twice is a no-op.
 */
public final class ScopeLease implements AutoCloseable {
    private final TemplateContext context;
    private final Scope scope;
    private boolean closed;

    ScopeLease(TemplateContext context, Scope scope) {
        this.context = context;
        this.scope = scope;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        context.release(scope);
    }
}
