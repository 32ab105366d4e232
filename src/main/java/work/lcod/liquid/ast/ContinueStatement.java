package work.lcod.liquid.ast;

public final class ContinueStatement extends Statement {
    public static final ContinueStatement INSTANCE = new ContinueStatement();

    private ContinueStatement() {}

    @Override
    public StatementKind kind() {
        return StatementKind.CONTINUE;
    }
}
