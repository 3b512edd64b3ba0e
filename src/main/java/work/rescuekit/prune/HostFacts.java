package work.rescuekit.prune;

/**
 * Facts about the host under analysis that decide whether a module may run.
 */
public interface HostFacts {
    /**
     * Short distribution identifier such as {@code alami2} or {@code ubuntu}.
     */
    String distro();

    boolean isRoot();

    /**
     * Whether the host is a cloud instance (false when the user passed {@code --not-an-instance}).
     */
    boolean isInstance();

    boolean perfImpactAllowed();

    /**
     * Whether {@code software} resolves to an executable file, either directly or on PATH.
     */
    boolean isExecutable(String software);

    default String netDriver() {
        return "Unknown";
    }

    default String virtType() {
        return isInstance() ? "unknown" : "non-virtualized";
    }
}
