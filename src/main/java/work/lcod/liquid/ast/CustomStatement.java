package work.lcod.liquid.ast;

import java.io.Writer;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.flow.Completion;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.text.TextEncoder;

/**
 * Extension point for tags contributed by a parser extension. Only the interpreter can run
 * them.
 */
public abstract class CustomStatement extends Statement {
    protected CustomStatement() {}

    public abstract String name();

    public abstract CompletableFuture<Completion> writeToAsync(Writer writer, TextEncoder encoder, TemplateContext context);

    @Override
    public final StatementKind kind() {
        return StatementKind.CUSTOM;
    }
}
