package work.lcod.liquid.runtime;

/**
 * Resolves members of host objects by name, case-insensitively.
 */
public interface MemberAccessStrategy {
    /**
     * The accessor for {@code name} on {@code type}, or null when the member is unknown.
     */
    MemberAccessor getAccessor(Class<?> type, String name);
}
