package work.rescuekit.exec;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rescuekit.config.RunOptions;
import work.rescuekit.module.HostEnvironment;
import work.rescuekit.module.Module;

/**
 * State shared by the control thread and every worker of one run.
 *
 * <p>Besides the immutable run inputs it holds the console "running modules" line, whose first-entry flag
 * is the only mutable state shared across workers outside the work queue.</p>
 */
public final class RunContext {
    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final RunOptions options;
    private final HostEnvironment environment;
    private final Optional<Duration> timeout;
    private final Path logDir;
    private final PrintStream console;

    private final ReentrantLock announceLock = new ReentrantLock();
    private boolean announced;

    private RunContext(Builder builder) {
        this.options = builder.options;
        this.environment = builder.environment;
        this.timeout = builder.timeout;
        this.logDir = builder.logDir;
        this.console = builder.console;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RunOptions options() {
        return options;
    }

    public HostEnvironment environment() {
        return environment;
    }

    public Optional<Duration> timeout() {
        return timeout;
    }

    public Optional<Path> logDir() {
        return Optional.ofNullable(logDir);
    }

    /**
     * Appends {@code module} to the console "Running Modules:" line, printing the header first if no module
     * has been announced yet.
     */
    public void notifyModuleRunning(Module module) {
        announceLock.lock();
        try {
            if (!announced) {
                console.println("Running Modules:");
                console.print(module.name());
                announced = true;
            } else {
                console.print(", " + module.name());
            }
            console.flush();
            log.info("Running module {}", module.qualifiedName());
        } finally {
            announceLock.unlock();
        }
    }

    public boolean anyModuleAnnounced() {
        announceLock.lock();
        try {
            return announced;
        } finally {
            announceLock.unlock();
        }
    }

    /**
     * Writes a module's captured output to {@code <logdir>/<placement>/<name>.log}. Does nothing when
     * no log directory is configured; write failures are logged, never thrown.
     */
    public void writeModuleLog(Module module, String text) {
        if (logDir == null) {
            return;
        }
        Path file = moduleLogPath(module);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, text == null ? "" : text, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            log.warn("module {}: unable to write log {}: {}", module.qualifiedName(), file, ex.getMessage());
        }
    }

    public Path moduleLogPath(Module module) {
        Objects.requireNonNull(logDir, "logDir");
        return logDir.resolve(module.placement().id()).resolve(module.name() + ".log");
    }

    public static final class Builder {
        private RunOptions options = RunOptions.empty();
        private HostEnvironment environment = HostEnvironment.of(null);
        private Optional<Duration> timeout = Optional.empty();
        private Path logDir;
        private PrintStream console = System.out;

        private Builder() {}

        public Builder options(RunOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public Builder environment(HostEnvironment environment) {
            this.environment = Objects.requireNonNull(environment, "environment");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Optional.ofNullable(timeout);
            return this;
        }

        public Builder logDir(Path logDir) {
            this.logDir = logDir;
            return this;
        }

        public Builder console(PrintStream console) {
            this.console = Objects.requireNonNull(console, "console");
            return this;
        }

        public RunContext build() {
            return new RunContext(this);
        }
    }
}
