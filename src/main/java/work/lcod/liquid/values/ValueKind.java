package work.lcod.liquid.values;

/**
 * Tag of every runtime value variant.
 */
public enum ValueKind {
    NIL,
    BLANK,
    EMPTY,
    BOOLEAN,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT,
    DATE_TIME,
    FUNCTION
}
