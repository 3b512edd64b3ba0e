package work.rescuekit.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.rescuekit.report.RunSummary;

/**
 * Outcome of a {@link DiagnosticRunner} run, printable as text or JSON.
 */
public record RunResult(
    Status status,
    Optional<Path> runDir,
    Optional<RunSummary> summary,
    List<String> failedModules,
    Optional<String> error,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        failedModules = List.copyOf(failedModules);
    }

    public static RunResult completed(Path runDir, RunSummary summary, List<String> failedModules, Instant startedAt) {
        return new RunResult(
            Status.COMPLETED, Optional.of(runDir), Optional.of(summary), failedModules, Optional.empty(), startedAt, Instant.now()
        );
    }

    public static RunResult aborted(Path runDir, String message, Instant startedAt) {
        return new RunResult(
            Status.ABORTED, Optional.ofNullable(runDir), Optional.empty(), List.of(), Optional.of(message), startedAt, Instant.now()
        );
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        runDir.ifPresent(dir -> serializable.put("runDir", dir.toString()));
        summary.ifPresent(value -> serializable.put("summary", value.toSerializableMap()));
        serializable.put("failedModules", new ArrayList<>(failedModules));
        error.ifPresent(message -> serializable.put("error", message));
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize run result", ex);
        }
    }

    public String toText() {
        StringBuilder text = new StringBuilder();
        summary.ifPresent(value -> text.append(value.render()));
        error.ifPresent(message -> text.append("Run aborted: ").append(message).append(System.lineSeparator()));
        runDir.ifPresent(dir -> text.append(System.lineSeparator())
            .append("The output logs are located in:").append(System.lineSeparator())
            .append(dir).append(System.lineSeparator()));
        return text.toString();
    }

    public enum Status {
        COMPLETED(0),
        ABORTED(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
