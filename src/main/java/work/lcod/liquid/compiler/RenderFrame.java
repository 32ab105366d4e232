package work.lcod.liquid.compiler;

import java.io.Writer;
import work.lcod.liquid.runtime.TemplateContext;
import work.lcod.liquid.text.TextEncoder;
import work.lcod.liquid.values.Value;

/**
 * Per-render state of a compiled routine: raw model-typed locals live in {@code slots}, macro
 * functions in {@code macros}. A macro invocation gets fresh slots and shares the macro table.
 */
record RenderFrame(
    TemplateContext context,
    Writer writer,
    TextEncoder encoder,
    Object model,
    Object[] slots,
    Value[] macros
) {
    RenderFrame withWriter(Writer other) {
        return new RenderFrame(context, other, encoder, model, slots, macros);
    }

    RenderFrame forMacro(TemplateContext callContext, Writer buffer) {
        return new RenderFrame(callContext, buffer, encoder, model, new Object[slots.length], macros);
    }
}
