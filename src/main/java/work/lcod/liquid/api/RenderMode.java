package work.lcod.liquid.api;

import java.util.Locale;

/**
 * How a template is executed. {@code AUTO} compiles and falls back to the interpreter when the
 * template holds a construct the compiler rejects.
 */
public enum RenderMode {
    INTERPRET,
    COMPILE,
    AUTO;

    public static RenderMode from(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return RenderMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported render mode: " + value);
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
