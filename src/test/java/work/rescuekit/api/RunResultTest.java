package work.rescuekit.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.rescuekit.module.SkipReason;
import work.rescuekit.prune.PruneReport;
import work.rescuekit.registry.ModuleRegistry;
import work.rescuekit.report.RunSummary;

class RunResultTest {
    @Test
    void completedResultSerializesToJson() throws Exception {
        var summary = RunSummary.of(new ModuleRegistry(), new PruneReport(List.of(), Map.of(SkipReason.REQUIRES_SUDO, 1)));
        var result = RunResult.completed(Paths.get("/tmp/run"), summary, List.of("arpcache"), Instant.EPOCH);

        var json = new ObjectMapper().readTree(result.toPrettyJson());

        assertEquals("completed", json.get("status").asText());
        assertEquals("/tmp/run", json.get("runDir").asText());
        assertEquals("arpcache", json.get("failedModules").get(0).asText());
        assertEquals(1, json.get("summary").get("skipped").get("requires_sudo").asInt());
        assertEquals(0, result.status().exitCode());
    }

    @Test
    void abortedResultCarriesTheError() {
        var result = RunResult.aborted(Paths.get("/tmp/run"), "Prediagnostic check 'ensureroot' failed", Instant.EPOCH);

        assertEquals(1, result.status().exitCode());
        assertTrue(result.toText().contains("Run aborted: Prediagnostic check 'ensureroot' failed"));
        assertTrue(result.toText().contains("/tmp/run"));
        assertTrue(result.summary().isEmpty());
    }

    @Test
    void logLevelParsing() {
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals(LogLevel.DEBUG, LogLevel.from(" debug "));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("chatty"));
    }
}
