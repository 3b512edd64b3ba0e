package work.rescuekit.api;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import work.rescuekit.config.ConfigFile;
import work.rescuekit.config.RunOptions;

/**
 * Immutable configuration of one diagnostic run.
 *
 * @param modulesRoot directory holding {@code pre.d}, {@code mod.d}, {@code post.d} and {@code bin}
 * @param workDir parent of the per-run output directories
 * @param concurrency number of workers, at least 1
 * @param timeout per-module limit; empty means modules may run forever
 */
public record RunConfiguration(
    Path modulesRoot,
    Path workDir,
    int concurrency,
    Optional<Duration> timeout,
    RunOptions options,
    LogLevel logLevel
) {
    public static final Path DEFAULT_WORK_DIR = Paths.get("/var/tmp/rescuekit");
    public static final int DEFAULT_CONCURRENCY = 10;

    public RunConfiguration {
        Objects.requireNonNull(modulesRoot, "modulesRoot");
        Objects.requireNonNull(workDir, "workDir");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(logLevel, "logLevel");
        concurrency = Math.max(1, concurrency);
    }

    public Path preDiagnosticDir() {
        return modulesRoot.resolve("pre.d");
    }

    public Path moduleDir() {
        return modulesRoot.resolve("mod.d");
    }

    public Path postDiagnosticDir() {
        return modulesRoot.resolve("post.d");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path modulesRoot;
        private Path workDir = DEFAULT_WORK_DIR;
        private int concurrency = DEFAULT_CONCURRENCY;
        private Optional<Duration> timeout = Optional.empty();
        private RunOptions options = RunOptions.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder modulesRoot(Path modulesRoot) {
            this.modulesRoot = modulesRoot;
            return this;
        }

        public Builder workDir(Path workDir) {
            this.workDir = workDir;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder options(RunOptions options) {
            this.options = options;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        /**
         * Takes every value present in {@code file}. Options are merged, file values winning.
         */
        public Builder apply(ConfigFile file) {
            file.modulesDir().ifPresent(this::modulesRoot);
            file.workDir().ifPresent(this::workDir);
            file.concurrency().ifPresent(this::concurrency);
            file.timeout().ifPresent(limit -> this.timeout = Optional.of(limit));
            this.options = options.toBuilder().merge(file.options()).build();
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(modulesRoot, workDir, concurrency, timeout, options, logLevel);
        }
    }
}
