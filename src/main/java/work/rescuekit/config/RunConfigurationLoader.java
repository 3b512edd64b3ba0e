package work.rescuekit.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.rescuekit.shared.DurationParser;

/**
 * Reads run settings from a TOML file.
 *
 * <pre>
 * [run]
 * modules_dir = "/opt/rescuekit"
 * work_dir = "/var/tmp/rescuekit"
 * concurrency = 4
 * timeout = "5m"
 *
 * [global]
 * perfimpact = true
 *
 * [modules.tcpdump]
 * interface = "eth0"
 * </pre>
 *
 * Booleans are stored as {@code True}/{@code False}, the spelling module scripts test for.
 */
public final class RunConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(RunConfigurationLoader.class);

    private RunConfigurationLoader() {}

    public static ConfigFile load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file not found: " + file);
        }
        try {
            return fromToml(Toml.parse(file), file.toString());
        } catch (IOException ex) {
            throw new ConfigurationException("Unable to read configuration file " + file + ": " + ex.getMessage(), ex);
        }
    }

    public static ConfigFile parse(String toml) {
        return fromToml(Toml.parse(toml), "<inline>");
    }

    private static ConfigFile fromToml(TomlParseResult result, String source) {
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(TomlParseError::toString).collect(Collectors.joining("; "));
            throw new ConfigurationException("Invalid configuration " + source + ": " + errors);
        }

        RunOptions.Builder options = RunOptions.builder();
        TomlTable global = table(result, source, "global");
        if (global != null) {
            for (String key : global.keySet()) {
                options.global(key, stringify(source, "global." + key, global.get(List.of(key))));
            }
        }
        TomlTable modules = table(result, source, "modules");
        if (modules != null) {
            for (String module : modules.keySet()) {
                Object section = modules.get(List.of(module));
                if (!(section instanceof TomlTable table)) {
                    throw new ConfigurationException("Invalid configuration " + source + ": modules." + module + " must be a table");
                }
                for (String key : table.keySet()) {
                    options.module(module, key, stringify(source, "modules." + module + "." + key, table.get(List.of(key))));
                }
            }
        }

        TomlTable run = table(result, source, "run");
        Optional<Path> modulesDir = Optional.empty();
        Optional<Path> workDir = Optional.empty();
        Optional<Integer> concurrency = Optional.empty();
        Optional<Duration> timeout = Optional.empty();
        if (run != null) {
            modulesDir = Optional.ofNullable(string(run, source, "modules_dir")).map(Paths::get);
            workDir = Optional.ofNullable(string(run, source, "work_dir")).map(Paths::get);
            if (run.contains("concurrency") && !run.isLong("concurrency")) {
                throw invalidType(source, "run.concurrency", "an integer");
            }
            Long rawConcurrency = run.getLong("concurrency");
            if (rawConcurrency != null) {
                concurrency = Optional.of((int) Math.max(1L, Math.min(rawConcurrency, Integer.MAX_VALUE)));
            }
            String rawTimeout = string(run, source, "timeout");
            try {
                timeout = DurationParser.parseLimit(rawTimeout);
            } catch (IllegalArgumentException ex) {
                throw new ConfigurationException("Invalid configuration " + source + ": run.timeout: " + ex.getMessage(), ex);
            }
        }
        log.debug("Loaded configuration from {}", source);
        return new ConfigFile(options.build(), modulesDir, workDir, concurrency, timeout);
    }

    private static TomlTable table(TomlTable parent, String source, String key) {
        if (parent.contains(key) && !parent.isTable(key)) {
            throw invalidType(source, key, "a table");
        }
        return parent.getTable(key);
    }

    private static String string(TomlTable table, String source, String key) {
        if (table.contains(key) && !table.isString(key)) {
            throw invalidType(source, "run." + key, "a string");
        }
        return table.getString(key);
    }

    private static ConfigurationException invalidType(String source, String key, String expected) {
        return new ConfigurationException("Invalid configuration " + source + ": " + key + " must be " + expected);
    }

    private static String stringify(String source, String key, Object value) {
        if (value instanceof Boolean flag) {
            return flag ? "True" : "False";
        }
        if (value instanceof TomlArray array) {
            return array.toList().stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        if (value instanceof TomlTable) {
            throw new ConfigurationException("Invalid configuration " + source + ": " + key + " must be a scalar value");
        }
        return String.valueOf(value);
    }
}
