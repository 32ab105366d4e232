package work.lcod.liquid.ast;

public enum SegmentKind {
    IDENTIFIER,
    INDEXER,
    CALL
}
