package work.lcod.liquid.flow;

/**
 * Base class for render and compile failures, carrying a stable error code.
 */
public class TemplateErrorException extends RuntimeException {
    private final String code;

    public TemplateErrorException(String code, String message) {
        super(message);
        this.code = code;
    }

    public TemplateErrorException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
