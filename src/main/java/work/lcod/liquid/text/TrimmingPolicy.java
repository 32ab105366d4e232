package work.lcod.liquid.text;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Which adjacencies trigger trimming and whether trimming consumes every whitespace character.
 */
public record TrimmingPolicy(Set<TrimmingFlag> flags, boolean greedy) {
    public static final TrimmingPolicy NONE = new TrimmingPolicy(Set.of(), true);

    public TrimmingPolicy {
        Objects.requireNonNull(flags, "flags");
        flags = flags.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public static TrimmingPolicy of(boolean greedy, TrimmingFlag... flags) {
        var set = EnumSet.noneOf(TrimmingFlag.class);
        Collections.addAll(set, flags);
        return new TrimmingPolicy(set, greedy);
    }

    public boolean has(TrimmingFlag flag) {
        return flags.contains(flag);
    }

    /**
     * Whether the left edge of a span is stripped given its explicit flag and its left neighbour.
     */
    public boolean stripsLeft(boolean explicit, Adjacent previous) {
        return explicit
            || (previous == Adjacent.TAG && has(TrimmingFlag.TAG_RIGHT))
            || (previous == Adjacent.OUTPUT && has(TrimmingFlag.OUTPUT_RIGHT));
    }

    /**
     * Whether the right edge of a span is stripped given its explicit flag and its right neighbour.
     */
    public boolean stripsRight(boolean explicit, Adjacent next) {
        return explicit
            || (next == Adjacent.TAG && has(TrimmingFlag.TAG_LEFT))
            || (next == Adjacent.OUTPUT && has(TrimmingFlag.OUTPUT_LEFT));
    }
}
