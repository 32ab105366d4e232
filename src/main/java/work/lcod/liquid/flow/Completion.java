package work.lcod.liquid.flow;

/**
 * Outcome of a statement: normal completion or a loop control signal travelling outwards.
 */
public enum Completion {
    NORMAL,
    BREAK,
    CONTINUE
}
