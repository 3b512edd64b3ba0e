package work.rescuekit.registry;

public final class DuplicateModuleNameException extends ModuleRegistryException {
    public DuplicateModuleNameException(String moduleName) {
        super("Duplicate module detected: '" + moduleName + "'");
    }
}
