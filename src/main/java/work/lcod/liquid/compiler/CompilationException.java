package work.lcod.liquid.compiler;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.ResourceBundle;
import work.lcod.liquid.flow.TemplateErrorException;

/**
 * Raised when a template contains a construct the compiler cannot lower. The message is
 * localised with the render locale; {@link #construct()} names the offending construct.
 */
public final class CompilationException extends TemplateErrorException {
    public static final String CODE = "unsupported_construct";
    static final String BUNDLE = "work.lcod.liquid.compiler.messages";

    private final String construct;

    private CompilationException(String construct, String message) {
        super(CODE, message);
        this.construct = construct;
    }

    public String construct() {
        return construct;
    }

    static CompilationException unsupportedStatement(String name, Locale locale) {
        return new CompilationException(name, format("unsupported.statement", locale, name));
    }

    static CompilationException unsupportedExpression(String name, Locale locale) {
        return new CompilationException(name, format("unsupported.expression", locale, name));
    }

    static CompilationException malformedMember(String description, Locale locale) {
        return new CompilationException(description, format("malformed.member", locale, description));
    }

    private static String format(String key, Locale locale, Object... arguments) {
        var effective = locale == null ? Locale.ROOT : locale;
        var bundle = ResourceBundle.getBundle(
            BUNDLE,
            effective,
            ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES)
        );
        var format = new MessageFormat(bundle.getString(key), effective);
        return format.format(arguments);
    }
}
