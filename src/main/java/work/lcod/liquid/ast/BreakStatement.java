package work.lcod.liquid.ast;

public final class BreakStatement extends Statement {
    public static final BreakStatement INSTANCE = new BreakStatement();

    private BreakStatement() {}

    @Override
    public StatementKind kind() {
        return StatementKind.BREAK;
    }
}
