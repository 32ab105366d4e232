package work.lcod.liquid.text;

/**
 * Adjacency kinds that enable whitespace trimming on a text span.
 */
public enum TrimmingFlag {
    /** Trim text on the left of a tag. */
    TAG_LEFT,
    /** Trim text on the right of a tag. */
    TAG_RIGHT,
    /** Trim text on the left of an output. */
    OUTPUT_LEFT,
    /** Trim text on the right of an output. */
    OUTPUT_RIGHT
}
