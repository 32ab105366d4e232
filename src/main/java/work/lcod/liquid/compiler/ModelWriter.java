package work.lcod.liquid.compiler;

import java.io.IOException;
import java.io.UncheckedIOException;
import work.lcod.liquid.runtime.TemplateInterpreter;
import work.lcod.liquid.values.Values;

/**
 * Writes raw model values. Strings go straight to the encoder; anything else is wrapped and
 * written the way an interpreted output would.
 */
final class ModelWriter {
    private ModelWriter() {}

    static void write(Object raw, RenderFrame frame) {
        if (raw == null) {
            return;
        }
        if (raw instanceof String text) {
            if (text.isEmpty()) {
                return;
            }
            try {
                frame.encoder().encode(frame.writer(), text);
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
            return;
        }
        var context = frame.context();
        TemplateInterpreter.writeValue(Values.create(raw, context.options()), frame.writer(), frame.encoder(), context);
    }
}
