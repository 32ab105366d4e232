package work.lcod.liquid.ast;

/**
 * One step of a member chain: {@code .name}, {@code [index]} or {@code (arguments)}.
 */
public abstract class MemberSegment {
    MemberSegment() {}

    public abstract SegmentKind kind();
}
