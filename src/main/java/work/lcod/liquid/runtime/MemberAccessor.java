package work.lcod.liquid.runtime;

/**
 * Reads one member of a host object. {@link #type()} is the declared member type and
 * {@link #elementType()} the element type when the member is an array or an
 * {@code Iterable}, otherwise null.
 */
public interface MemberAccessor {
    Object get(Object target);

    Class<?> type();

    Class<?> elementType();
}
