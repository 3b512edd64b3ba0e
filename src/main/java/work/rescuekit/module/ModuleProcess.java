package work.rescuekit.module;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rescuekit.config.RunOptions;

/**
 * Launches a module as a child process with a restricted environment and captures its output.
 */
final class ModuleProcess {
    private static final Logger log = LoggerFactory.getLogger(ModuleProcess.class);

    static final String BASH_INTERPRETER = "/bin/bash";
    static final String PYTHON_INTERPRETER = "python3";

    private ModuleProcess() {}

    static String execute(Module module, RunOptions options, HostEnvironment host, Optional<Duration> timeout)
        throws ModuleRunFailureException {
        Map<String, String> environment = buildEnvironment(module, options, host);
        Path script = null;
        Path capture = null;
        try {
            List<String> command;
            switch (module.language()) {
                case BINARY -> command = List.of(binaryPath(module, environment).toString());
                case BASH -> {
                    script = writeScript(module, ".sh");
                    command = List.of(BASH_INTERPRETER, script.toString());
                }
                case PYTHON -> {
                    script = writeScript(module, ".py");
                    command = List.of(PYTHON_INTERPRETER, script.toString());
                }
                default -> throw new ModuleUnsupportedLanguageException(module.name(), module.language().id());
            }
            log.info("module {}: command = {}", module.qualifiedName(), command);
            capture = Files.createTempFile("rescuekit-" + module.name() + "-", ".out");
            return launch(module, command, environment, capture, timeout);
        } catch (IOException ex) {
            throw new ModuleRunFailureException(
                "Module execution failed: " + module.placement().id() + ":" + module.name() + ", " + ex.getMessage(),
                "",
                ex
            );
        } finally {
            deleteTemporary(script);
            deleteTemporary(capture);
        }
    }

    /**
     * PATH and the host facts first, then global options, then the module's own options.
     */
    static Map<String, String> buildEnvironment(Module module, RunOptions options, HostEnvironment host) {
        Map<String, String> environment = new LinkedHashMap<>(host == null ? Map.of() : host.asMap());
        if (options != null) {
            options.globalArgs().forEach((key, value) -> environment.put(key, String.valueOf(value)));
            Map<String, String> own = options.moduleArgs(module.name());
            if (!own.isEmpty()) {
                log.debug("module {}: applying {} per-module option(s)", module.qualifiedName(), own.size());
                own.forEach((key, value) -> environment.put(key, String.valueOf(value)));
            }
        }
        return environment;
    }

    static Path binaryPath(Module module, Map<String, String> environment) throws IOException {
        String callPath = environment.get(HostEnvironment.CALLPATH);
        if (callPath == null || callPath.isBlank()) {
            throw new IOException(HostEnvironment.CALLPATH + " is not set; cannot locate binary module");
        }
        return Paths.get(callPath, "bin", module.placement().directoryName(), module.name());
    }

    private static Path writeScript(Module module, String suffix) throws IOException {
        Path script = Files.createTempFile("rescuekit-" + module.name() + "-", suffix);
        Files.writeString(script, module.content(), StandardCharsets.UTF_8);
        return script;
    }

    private static String launch(
        Module module,
        List<String> command,
        Map<String, String> environment,
        Path capture,
        Optional<Duration> timeout
    ) throws IOException, ModuleRunFailureException {
        ProcessBuilder builder = new ProcessBuilder(command)
            .redirectErrorStream(true)
            .redirectOutput(capture.toFile());
        builder.environment().clear();
        builder.environment().putAll(environment);
        String runDir = environment.get(HostEnvironment.RUNDIR);
        if (runDir != null && Files.isDirectory(Paths.get(runDir))) {
            builder.directory(Paths.get(runDir).toFile());
        }

        Process process = builder.start();
        int exitCode;
        try {
            if (timeout.isPresent()) {
                if (!process.waitFor(timeout.get().toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    process.waitFor();
                    String partial = readCapture(capture);
                    throw new ModuleRunFailureException(
                        "Module execution timed out: " + module.placement().id() + ":" + module.name()
                            + " after " + timeout.get().toMillis() + "ms",
                        partial
                    );
                }
                exitCode = process.exitValue();
            } else {
                exitCode = process.waitFor();
            }
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ModuleRunFailureException(
                "Interrupted while running module " + module.qualifiedName(),
                readCapture(capture),
                ex
            );
        }

        String output = readCapture(capture);
        if (exitCode != 0) {
            String message = "Module execution failed: " + module.placement().id() + ":" + module.name()
                + ", returned " + exitCode;
            log.debug(message);
            log.debug("module {}: output was {}", module.qualifiedName(), output);
            throw new ModuleRunFailureException(message, output);
        }
        return output;
    }

    // Lenient decoding; modules may print arbitrary bytes.
    private static String readCapture(Path capture) throws IOException {
        return new String(Files.readAllBytes(capture), StandardCharsets.UTF_8);
    }

    private static void deleteTemporary(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("Unable to delete temporary file {}: {}", file, ex.getMessage());
        }
    }
}
