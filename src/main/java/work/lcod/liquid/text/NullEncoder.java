package work.lcod.liquid.text;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes values as-is.
 */
public final class NullEncoder implements TextEncoder {
    public static final NullEncoder DEFAULT = new NullEncoder();

    private NullEncoder() {}

    @Override
    public void encode(Writer writer, String value) throws IOException {
        if (value != null && !value.isEmpty()) {
            writer.write(value);
        }
    }
}
