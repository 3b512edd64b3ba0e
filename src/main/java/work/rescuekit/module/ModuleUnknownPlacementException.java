package work.rescuekit.module;

public final class ModuleUnknownPlacementException extends ModuleParseException {
    public ModuleUnknownPlacementException(String module, String placement) {
        super("Unknown Placement '" + placement + "' defined for module '" + module + "'.");
    }
}
