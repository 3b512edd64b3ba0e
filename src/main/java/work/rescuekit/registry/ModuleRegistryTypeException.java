package work.rescuekit.registry;

public final class ModuleRegistryTypeException extends ModuleRegistryException {
    public ModuleRegistryTypeException(Object item, String expected) {
        super("Unexpected item of type: '" + (item == null ? "null" : item.getClass().getSimpleName())
            + "'. Expected '" + expected + "'.");
    }
}
