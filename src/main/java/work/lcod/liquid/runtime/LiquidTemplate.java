package work.lcod.liquid.runtime;

import java.io.StringWriter;
import java.io.Writer;
import java.util.concurrent.CompletableFuture;
import work.lcod.liquid.flow.AsyncFlow;
import work.lcod.liquid.text.HtmlEncoder;
import work.lcod.liquid.text.TextEncoder;

/**
 * A template ready to render, either interpreted or compiled.
 */
public interface LiquidTemplate {
    /**
     * Renders into {@code writer}, flushing it on normal completion.
     */
    CompletableFuture<Void> renderAsync(Writer writer, TextEncoder encoder, TemplateContext context);

    default String render(TemplateContext context) {
        return render(context, HtmlEncoder.DEFAULT);
    }

    default String render(TemplateContext context, TextEncoder encoder) {
        var writer = new StringWriter();
        AsyncFlow.await(renderAsync(writer, encoder, context));
        return writer.toString();
    }
}
