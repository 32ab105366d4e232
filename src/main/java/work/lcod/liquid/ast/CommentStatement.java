package work.lcod.liquid.ast;

public final class CommentStatement extends Statement {
    private final String text;

    public CommentStatement(String text) {
        this.text = text == null ? "" : text;
    }

    public String text() {
        return text;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.COMMENT;
    }
}
