package work.lcod.liquid.ast;

import java.util.Objects;
import work.lcod.liquid.text.Adjacent;
import work.lcod.liquid.text.TrimmingPolicy;
import work.lcod.liquid.text.WhitespaceTrimmer;

/**
 * Raw template text between tags. The trimmed buffer is computed on first use and reused by
 * every later render; the policy seen first wins.
 */
public final class TextSpanStatement extends Statement {
    private final String text;
    private final boolean stripLeft;
    private final boolean stripRight;
    private final Adjacent previous;
    private final Adjacent next;
    private final Object lock = new Object();
    private volatile String resolved;

    public TextSpanStatement(String text) {
        this(text, false, false, Adjacent.NONE, Adjacent.NONE);
    }

    public TextSpanStatement(String text, boolean stripLeft, boolean stripRight) {
        this(text, stripLeft, stripRight, Adjacent.NONE, Adjacent.NONE);
    }

    public TextSpanStatement(String text, boolean stripLeft, boolean stripRight, Adjacent previous, Adjacent next) {
        this.text = text == null ? "" : text;
        this.stripLeft = stripLeft;
        this.stripRight = stripRight;
        this.previous = Objects.requireNonNull(previous, "previous");
        this.next = Objects.requireNonNull(next, "next");
    }

    public String text() {
        return text;
    }

    public boolean stripLeft() {
        return stripLeft;
    }

    public boolean stripRight() {
        return stripRight;
    }

    public Adjacent previous() {
        return previous;
    }

    public Adjacent next() {
        return next;
    }

    /**
     * Copy of this span seen between the given neighbours; returns {@code this} when nothing
     * changes.
     */
    public TextSpanStatement withNeighbours(Adjacent previous, Adjacent next) {
        if (this.previous == previous && this.next == next) {
            return this;
        }
        return new TextSpanStatement(text, stripLeft, stripRight, previous, next);
    }

    public boolean isResolved() {
        return resolved != null;
    }

    public String resolve(TrimmingPolicy policy) {
        var cached = resolved;
        if (cached != null) {
            return cached;
        }
        synchronized (lock) {
            if (resolved == null) {
                resolved = WhitespaceTrimmer.trim(
                    text,
                    policy.stripsLeft(stripLeft, previous),
                    policy.stripsRight(stripRight, next),
                    policy.greedy()
                );
            }
            return resolved;
        }
    }

    @Override
    public StatementKind kind() {
        return StatementKind.TEXT_SPAN;
    }

    @Override
    public Adjacent adjacency() {
        return Adjacent.NONE;
    }
}
