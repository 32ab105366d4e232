package work.lcod.liquid.ast;

public enum StatementKind {
    TEXT_SPAN,
    OUTPUT,
    FOR,
    IF,
    MACRO,
    BREAK,
    CONTINUE,
    ASSIGN,
    CAPTURE,
    COMMENT,
    CUSTOM
}
