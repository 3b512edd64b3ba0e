package work.rescuekit.module;

public final class ModuleUnsupportedLanguageException extends ModuleParseException {
    public ModuleUnsupportedLanguageException(String module, String language) {
        super("Unsupported language '" + language + "' defined for module '" + module + "'.");
    }
}
