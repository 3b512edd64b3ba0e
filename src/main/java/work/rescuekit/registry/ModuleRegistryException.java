package work.rescuekit.registry;

/**
 * Base type for registry membership errors.
 */
public class ModuleRegistryException extends RuntimeException {
    public ModuleRegistryException(String message) {
        super(message);
    }
}
