package work.rescuekit.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Argument values handed to modules: global key/value pairs plus per-module overrides.
 * Keys are the dash-less option names (e.g. {@code perfimpact}, {@code onlymodules}).
 */
public record RunOptions(Map<String, String> globalArgs, Map<String, Map<String, String>> perModuleArgs) {
    public static final String ONLY_MODULES = "onlymodules";
    public static final String ONLY_DOMAINS = "onlydomains";
    public static final String ONLY_CLASSES = "onlyclasses";
    public static final String PERF_IMPACT = "perfimpact";
    public static final String NOT_AN_INSTANCE = "notaninstance";
    public static final String CONCURRENCY = "concurrency";

    public RunOptions {
        globalArgs = Collections.unmodifiableMap(new LinkedHashMap<>(globalArgs == null ? Map.of() : globalArgs));
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        if (perModuleArgs != null) {
            perModuleArgs.forEach((module, args) ->
                copy.put(module, Collections.unmodifiableMap(new LinkedHashMap<>(args))));
        }
        perModuleArgs = Collections.unmodifiableMap(copy);
    }

    public static RunOptions empty() {
        return new RunOptions(Map.of(), Map.of());
    }

    public Optional<String> global(String key) {
        return Optional.ofNullable(globalArgs.get(key));
    }

    public Map<String, String> moduleArgs(String moduleName) {
        return perModuleArgs.getOrDefault(moduleName, Map.of());
    }

    public boolean hasModuleArgs(String moduleName) {
        return perModuleArgs.containsKey(moduleName);
    }

    /**
     * Case-insensitive check for a "true" global flag.
     */
    public boolean isTrue(String key) {
        return global(key).map(value -> "true".equalsIgnoreCase(value.trim())).orElse(false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.globals(globalArgs);
        perModuleArgs.forEach((module, args) -> args.forEach((key, value) -> builder.module(module, key, value)));
        return builder;
    }

    public static final class Builder {
        private final Map<String, String> globalArgs = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> perModuleArgs = new LinkedHashMap<>();

        public Builder global(String key, Object value) {
            if (key != null && value != null) {
                globalArgs.put(key, String.valueOf(value));
            }
            return this;
        }

        public Builder globals(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::global);
            }
            return this;
        }

        public Builder module(String moduleName, String key, Object value) {
            if (moduleName != null && key != null && value != null) {
                perModuleArgs.computeIfAbsent(moduleName, ignored -> new LinkedHashMap<>()).put(key, String.valueOf(value));
            }
            return this;
        }

        /**
         * Copies every value of {@code other}, overriding values already present.
         */
        public Builder merge(RunOptions other) {
            if (other != null) {
                globals(other.globalArgs());
                other.perModuleArgs().forEach((module, args) -> args.forEach((key, value) -> module(module, key, value)));
            }
            return this;
        }

        public RunOptions build() {
            return new RunOptions(globalArgs, perModuleArgs);
        }
    }
}
