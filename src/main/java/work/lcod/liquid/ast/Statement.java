package work.lcod.liquid.ast;

import work.lcod.liquid.text.Adjacent;

/**
 * Immutable statement node. The set of kinds is closed; parser extensions go through
 * {@link CustomStatement}.
 */
public abstract class Statement {
    Statement() {}

    public abstract StatementKind kind();

    /**
     * How this statement is seen by a neighbouring text span when trimming whitespace.
     */
    public Adjacent adjacency() {
        return Adjacent.TAG;
    }
}
