package work.rescuekit.module;

import java.util.Locale;

public enum Language {
    BASH("bash"),
    PYTHON("python"),
    BINARY("binary");

    private final String id;

    Language(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Language from(String moduleName, String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Language language : values()) {
                if (language.id.equals(normalized)) {
                    return language;
                }
            }
        }
        throw new ModuleUnsupportedLanguageException(moduleName, value);
    }

    @Override
    public String toString() {
        return id;
    }
}
