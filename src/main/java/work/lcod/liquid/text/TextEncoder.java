package work.lcod.liquid.text;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Encodes rendered values before they reach the output sink. Text spans are never encoded.
 */
@FunctionalInterface
public interface TextEncoder {
    void encode(Writer writer, String value) throws IOException;

    default String encode(String value) {
        var buffer = new StringWriter(value == null ? 0 : value.length());
        try {
            encode(buffer, value);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return buffer.toString();
    }
}
