package work.rescuekit.module;

/**
 * A module document is unreadable or misses a required attribute.
 */
public class ModuleParseException extends ModuleException {
    public ModuleParseException(String message) {
        super(message);
    }

    public ModuleParseException(String message, Throwable cause) {
        super(message, cause);
    }

    static ModuleParseException missing(String module, String attribute) {
        return new ModuleParseException(
            "Module('" + module + "'): must have a " + attribute + " value in the configuration file!"
        );
    }
}
