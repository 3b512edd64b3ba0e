package work.rescuekit.module;

import java.util.Locale;

/**
 * Lifecycle stage a module runs in, together with the catalog directory that holds it.
 */
public enum Placement {
    PREDIAGNOSTIC("prediagnostic", "pre.d"),
    RUN("run", "mod.d"),
    POSTDIAGNOSTIC("postdiagnostic", "post.d");

    private final String id;
    private final String directoryName;

    Placement(String id, String directoryName) {
        this.id = id;
        this.directoryName = directoryName;
    }

    public String id() {
        return id;
    }

    public String directoryName() {
        return directoryName;
    }

    public static Placement from(String moduleName, String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Placement placement : values()) {
                if (placement.id.equals(normalized)) {
                    return placement;
                }
            }
        }
        throw new ModuleUnknownPlacementException(moduleName, value);
    }

    @Override
    public String toString() {
        return id;
    }
}
