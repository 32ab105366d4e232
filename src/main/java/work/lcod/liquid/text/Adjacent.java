package work.lcod.liquid.text;

/**
 * What sits next to a text span in the source.
 */
public enum Adjacent {
    NONE,
    TAG,
    OUTPUT
}
