package work.rescuekit.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Values read from a TOML configuration file. Everything except the options is optional so the
 * command line can fill the gaps.
 */
public record ConfigFile(
    RunOptions options,
    Optional<Path> modulesDir,
    Optional<Path> workDir,
    Optional<Integer> concurrency,
    Optional<Duration> timeout
) {
    public ConfigFile {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(modulesDir, "modulesDir");
        Objects.requireNonNull(workDir, "workDir");
        Objects.requireNonNull(concurrency, "concurrency");
        Objects.requireNonNull(timeout, "timeout");
    }

    public static ConfigFile empty() {
        return new ConfigFile(RunOptions.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }
}
