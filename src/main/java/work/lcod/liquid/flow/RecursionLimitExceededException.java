package work.lcod.liquid.flow;

/**
 * Raised when nested scopes (macro calls, loops) go deeper than the configured ceiling.
 */
public final class RecursionLimitExceededException extends TemplateErrorException {
    public static final String CODE = "recursion_limit_exceeded";

    private final int maxRecursion;

    public RecursionLimitExceededException(int maxRecursion) {
        super(CODE, "The maximum level of recursion has been reached (" + maxRecursion + ")");
        this.maxRecursion = maxRecursion;
    }

    public int maxRecursion() {
        return maxRecursion;
    }
}
