package work.lcod.liquid.ast;

import java.util.Objects;

public final class IdentifierSegment extends MemberSegment {
    private final String identifier;

    public IdentifierSegment(String identifier) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
    }

    public String identifier() {
        return identifier;
    }

    @Override
    public SegmentKind kind() {
        return SegmentKind.IDENTIFIER;
    }
}
