package work.rescuekit.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.rescuekit.module.Module;
import work.rescuekit.module.SkipReason;
import work.rescuekit.module.Verdict;
import work.rescuekit.prune.PruneReport;
import work.rescuekit.registry.ModuleRegistry;
import work.rescuekit.support.ModuleFixtures;

class RunSummaryTest {
    private static Module diagnose(String name, String output) {
        var module = ModuleFixtures.module(name).with("class", "diagnose").build();
        if (output != null) {
            module.recordOutput(output);
        }
        return module;
    }

    private static ModuleRegistry registry() {
        var registry = new ModuleRegistry();
        registry.append(diagnose("ok", "[SUCCESS] fine"));
        registry.append(diagnose("bad", "[FAILURE] broken\n-- reason"));
        registry.append(diagnose("meh", "[WARN] odd"));
        registry.append(diagnose("silent", "nothing useful"));
        registry.append(diagnose("crashed", null));
        var collector = ModuleFixtures.module("collector").with("class", "collect").build();
        collector.recordOutput("[SUCCESS] collected");
        registry.append(collector);
        return registry;
    }

    @Test
    void countsVerdictsOfDiagnoseModules() {
        var summary = RunSummary.of(registry(), PruneReport.empty());

        assertEquals(6, summary.totalRun());
        assertEquals(1, summary.diagnoseCount(Verdict.SUCCESS));
        assertEquals(1, summary.diagnoseCount(Verdict.FAILURE));
        assertEquals(1, summary.diagnoseCount(Verdict.WARN));
        assertEquals(2, summary.diagnoseCount(Verdict.UNKNOWN));
        assertEquals(Map.of("diagnose", 5, "collect", 1), summary.classCounts());
    }

    @Test
    void keepsOnlyTrackedSkipReasons() {
        var report = new PruneReport(List.of(), Map.of(
            SkipReason.REQUIRES_SUDO, 2,
            SkipReason.MISSING_ARGUMENT, 1,
            SkipReason.NOT_SELECTED, 7
        ));

        var summary = RunSummary.of(new ModuleRegistry(), report);

        assertEquals(2, summary.skipped(SkipReason.REQUIRES_SUDO));
        assertEquals(1, summary.skipped(SkipReason.MISSING_ARGUMENT));
        assertEquals(0, summary.skipped(SkipReason.NOT_SELECTED));
        assertFalse(summary.skipHistogram().containsKey(SkipReason.NOT_SELECTED));
    }

    @Test
    void rendersResultsStatsAndSkipTable() {
        var report = new PruneReport(List.of(), Map.of(SkipReason.REQUIRES_SUDO, 1));
        var text = RunSummary.of(registry(), report).render();

        assertTrue(text.contains("----------[Diagnostic Results]----------"));
        assertTrue(text.contains(String.format("%-32s %s", "module run/bad", "[FAILURE] broken")));
        assertTrue(text.contains(String.format("%-32s %s", " ", "-- reason")));
        assertTrue(text.contains(String.format("%-32s %s", "Total modules run:", 6)));
        assertTrue(text.contains(String.format("%-32s %s", "    unknown:", 2)));
        assertTrue(text.contains("Modules not run due to missing:"));
        assertTrue(text.indexOf("module run/bad") < text.indexOf("module run/ok"), "FAILURE sorts before SUCCESS");
    }

    @Test
    void emptyRunRendersOnlyStats() {
        var text = RunSummary.of(new ModuleRegistry(), PruneReport.empty()).render();

        assertFalse(text.contains("Diagnostic Results"));
        assertFalse(text.contains("Modules not run"));
        assertTrue(text.contains(String.format("%-32s %s", "Total modules run:", 0)));
    }

    @Test
    void serializableFormUsesLowerCaseNames() {
        var map = RunSummary.of(registry(), new PruneReport(List.of(), Map.of(SkipReason.MISSING_SOFTWARE, 3)))
            .toSerializableMap();

        assertEquals(6, map.get("totalRun"));
        assertEquals(Map.of("unknown", 2, "success", 1, "warn", 1, "failure", 1), map.get("diagnose"));
        assertEquals(Map.of("missing_software", 3), map.get("skipped"));
    }
}
