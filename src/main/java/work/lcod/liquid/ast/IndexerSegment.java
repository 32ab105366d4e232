package work.lcod.liquid.ast;

import java.util.Objects;

public final class IndexerSegment extends MemberSegment {
    private final Expression index;

    public IndexerSegment(Expression index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    public Expression index() {
        return index;
    }

    @Override
    public SegmentKind kind() {
        return SegmentKind.INDEXER;
    }
}
