package work.lcod.liquid.ast;

/**
 * Immutable expression node. The set of kinds is closed; parser extensions go through
 * {@link CustomExpression}.
 */
public abstract class Expression {
    Expression() {}

    public abstract ExpressionKind kind();
}
