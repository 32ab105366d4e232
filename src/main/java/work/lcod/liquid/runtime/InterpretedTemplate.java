package work.lcod.liquid.runtime;

import java.io.Writer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.ast.Ast;
import work.lcod.liquid.ast.Statement;
import work.lcod.liquid.text.Adjacent;
import work.lcod.liquid.text.TextEncoder;

/**
 * Root of a template tree, rendered by walking it.
 */
public final class InterpretedTemplate implements LiquidTemplate {
    private final List<Statement> statements;

    public InterpretedTemplate(List<Statement> statements) {
        this.statements = Ast.link(statements, Adjacent.NONE, Adjacent.NONE);
    }

    public static InterpretedTemplate of(Statement... statements) {
        return new InterpretedTemplate(List.of(statements));
    }

    public List<Statement> statements() {
        return statements;
    }

    @Override
    public CompletableFuture<Void> renderAsync(Writer writer, TextEncoder encoder, TemplateContext context) {
        return TemplateInterpreter.render(statements, context, writer, encoder);
    }
}
