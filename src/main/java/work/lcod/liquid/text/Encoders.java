package work.lcod.liquid.text;

import java.util.Locale;

/**
 * Resolves encoder names used by configuration files and the command line.
 */
public final class Encoders {
    private Encoders() {}

    public static TextEncoder byName(String name) {
        if (name == null || name.isBlank()) {
            return HtmlEncoder.DEFAULT;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "html" -> HtmlEncoder.DEFAULT;
            case "none", "null", "raw" -> NullEncoder.DEFAULT;
            default -> throw new IllegalArgumentException("Unsupported encoder: " + name);
        };
    }
}
