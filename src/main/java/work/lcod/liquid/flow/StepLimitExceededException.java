package work.lcod.liquid.flow;

/**
 * Raised once a render performs more steps than its configured ceiling.
 */
public final class StepLimitExceededException extends TemplateErrorException {
    public static final String CODE = "step_limit_exceeded";

    private final long maxSteps;

    public StepLimitExceededException(long maxSteps) {
        super(CODE, "The maximum number of statements has been reached (" + maxSteps + ")");
        this.maxSteps = maxSteps;
    }

    public long maxSteps() {
        return maxSteps;
    }
}
