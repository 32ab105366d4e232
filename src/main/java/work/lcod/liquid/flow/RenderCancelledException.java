package work.lcod.liquid.flow;

/**
 * Raised at the next step boundary after the context's cancellation token fired.
 */
public final class RenderCancelledException extends TemplateErrorException {
    public static final String CODE = "render_cancelled";

    public RenderCancelledException(String message) {
        super(CODE, message);
    }
}
