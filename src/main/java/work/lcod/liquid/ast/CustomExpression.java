package work.lcod.liquid.ast;

import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.values.Value;

/**
 * Extension point for expressions contributed by a parser extension. Only the interpreter can
 * run them.
 */
public abstract class CustomExpression extends Expression {
    protected CustomExpression() {}

    public abstract String name();

    public abstract CompletableFuture<Value> evaluateAsync(TemplateContext context);

    @Override
    public final ExpressionKind kind() {
        return ExpressionKind.CUSTOM;
    }
}
