package work.rescuekit.registry;

public final class ModuleNotPresentException extends ModuleRegistryException {
    public ModuleNotPresentException(String moduleName) {
        super("Failed to remove '" + moduleName + "'. Not present in the module registry.");
    }
}
