package work.lcod.liquid.ast;

import java.util.Objects;

/**
 * A declared macro parameter; {@code defaultValue} is null when the parameter has no default.
 */
public record MacroParameter(String name, Expression defaultValue) {
    public MacroParameter {
        Objects.requireNonNull(name, "name");
    }

    public static MacroParameter of(String name) {
        return new MacroParameter(name, null);
    }
}
