package work.lcod.liquid.ast;

import java.util.List;

public final class FunctionCallSegment extends MemberSegment {
    private final List<ArgumentExpression> arguments;

    public FunctionCallSegment(List<ArgumentExpression> arguments) {
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public List<ArgumentExpression> arguments() {
        return arguments;
    }

    @Override
    public SegmentKind kind() {
        return SegmentKind.CALL;
    }
}
