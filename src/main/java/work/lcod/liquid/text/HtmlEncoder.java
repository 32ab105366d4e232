package work.lcod.liquid.text;

import java.io.IOException;
import java.io.Writer;

/**
 * Escapes the characters that are significant in HTML text and attribute values.
 */
public final class HtmlEncoder implements TextEncoder {
    public static final HtmlEncoder DEFAULT = new HtmlEncoder();

    private HtmlEncoder() {}

    @Override
    public void encode(Writer writer, String value) throws IOException {
        if (value == null || value.isEmpty()) {
            return;
        }
        int last = 0;
        for (int i = 0; i < value.length(); i++) {
            String replacement = switch (value.charAt(i)) {
                case '&' -> "&amp;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> "&quot;";
                case '\'' -> "&#39;";
                default -> null;
            };
            if (replacement == null) {
                continue;
            }
            if (i > last) {
                writer.write(value, last, i - last);
            }
            writer.write(replacement);
            last = i + 1;
        }
        if (last < value.length()) {
            writer.write(value, last, value.length() - last);
        }
    }
}
