package work.lcod.liquid.flow;

/**
 * Internal-consistency failure: the node tree has a shape no producer should emit.
 */
public final class MalformedTemplateException extends TemplateErrorException {
    public static final String CODE = "malformed_template";

    public MalformedTemplateException(String message) {
        super(CODE, message);
    }
}
