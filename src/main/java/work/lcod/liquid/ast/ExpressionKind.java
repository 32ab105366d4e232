package work.lcod.liquid.ast;

public enum ExpressionKind {
    LITERAL,
    MEMBER,
    RANGE,
    FILTER,
    BINARY,
    CUSTOM
}
