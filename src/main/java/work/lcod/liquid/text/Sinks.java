package work.lcod.liquid.text;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Write helpers that surface sink failures as {@link UncheckedIOException} so they can travel
 * through future chains.
 */
public final class Sinks {
    private Sinks() {}

    public static void write(Writer writer, String text) {
        try {
            writer.write(text);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static void flush(Writer writer) {
        try {
            writer.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
