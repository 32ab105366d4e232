package work.lcod.liquid.ast;

import java.util.List;

/**
 * A name followed by member, index and call segments. The first segment is expected to be an
 * identifier; anything else is reported as malformed when the expression is evaluated.
 */
public final class MemberExpression extends Expression {
    private final List<MemberSegment> segments;

    public MemberExpression(List<MemberSegment> segments) {
        this.segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public List<MemberSegment> segments() {
        return segments;
    }

    /**
     * The root name, or null when the chain does not start with an identifier.
     */
    public String rootIdentifier() {
        if (segments.isEmpty() || !(segments.get(0) instanceof IdentifierSegment identifier)) {
            return null;
        }
        return identifier.identifier();
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.MEMBER;
    }
}
