package work.rescuekit.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.rescuekit.module.Module;
import work.rescuekit.module.SkipReason;
import work.rescuekit.module.Verdict;
import work.rescuekit.prune.PruneReport;
import work.rescuekit.registry.ModuleRegistry;

/**
 * Read-only projection of a finished run: verdict counts over {@code diagnose} modules, module counts per
 * class and the histogram of tracked skip reasons.
 */
public final class RunSummary {
    public static final String DIAGNOSE_CLASS = "diagnose";

    private static final String LINE = System.lineSeparator();

    private final int totalRun;
    private final Map<Verdict, Integer> diagnoseVerdicts;
    private final Map<String, Integer> classCounts;
    private final Map<SkipReason, Integer> skipHistogram;
    private final List<Module> diagnoseModules;

    private RunSummary(
        int totalRun,
        Map<Verdict, Integer> diagnoseVerdicts,
        Map<String, Integer> classCounts,
        Map<SkipReason, Integer> skipHistogram,
        List<Module> diagnoseModules
    ) {
        this.totalRun = totalRun;
        this.diagnoseVerdicts = Collections.unmodifiableMap(diagnoseVerdicts);
        this.classCounts = Collections.unmodifiableMap(classCounts);
        this.skipHistogram = Collections.unmodifiableMap(skipHistogram);
        this.diagnoseModules = List.copyOf(diagnoseModules);
    }

    /**
     * Summarizes the modules left in {@code registry} after execution. A module with no verdict (it failed
     * to run) counts as {@link Verdict#UNKNOWN}.
     */
    public static RunSummary of(ModuleRegistry registry, PruneReport pruneReport) {
        Map<Verdict, Integer> verdicts = new EnumMap<>(Verdict.class);
        for (Verdict verdict : Verdict.values()) {
            verdicts.put(verdict, 0);
        }
        List<Module> diagnose = registry.classIndex().getOrDefault(DIAGNOSE_CLASS, List.of());
        for (Module module : diagnose) {
            verdicts.merge(verdictOf(module), 1, Integer::sum);
        }

        Map<String, Integer> classes = new LinkedHashMap<>();
        registry.classIndex().forEach((name, members) -> classes.put(name, members.size()));

        Map<SkipReason, Integer> histogram = new EnumMap<>(SkipReason.class);
        pruneReport.histogram().forEach((reason, count) -> {
            if (reason.tracked()) {
                histogram.put(reason, count);
            }
        });
        return new RunSummary(registry.size(), verdicts, classes, histogram, diagnose);
    }

    private static Verdict verdictOf(Module module) {
        return module.verdict().orElse(Verdict.UNKNOWN);
    }

    public int totalRun() {
        return totalRun;
    }

    public int diagnoseCount(Verdict verdict) {
        return diagnoseVerdicts.getOrDefault(verdict, 0);
    }

    public Map<Verdict, Integer> diagnoseVerdicts() {
        return diagnoseVerdicts;
    }

    public Map<String, Integer> classCounts() {
        return classCounts;
    }

    public int skipped(SkipReason reason) {
        return skipHistogram.getOrDefault(reason, 0);
    }

    public Map<SkipReason, Integer> skipHistogram() {
        return skipHistogram;
    }

    /**
     * Console rendering: per-module diagnostic results grouped by verdict, run statistics and the skip table.
     */
    public String render() {
        StringBuilder out = new StringBuilder();
        if (!diagnoseModules.isEmpty()) {
            out.append(LINE).append("----------[Diagnostic Results]----------").append(LINE).append(LINE);
            List<Module> sorted = new ArrayList<>(diagnoseModules);
            sorted.sort(Comparator.comparing((Module module) -> verdictOf(module).name()));
            for (Module module : sorted) {
                out.append(row("module " + module.qualifiedName(), module.summary()));
                for (String detail : module.details()) {
                    out.append(row(" ", detail));
                }
            }
        }

        out.append(LINE).append("--------------[Run  Stats]--------------").append(LINE).append(LINE);
        out.append(row("Total modules run:", totalRun));
        if (totalRun > 0) {
            classCounts.forEach((name, count) -> {
                out.append(row("'" + name + "' modules run:", count));
                if (DIAGNOSE_CLASS.equals(name)) {
                    out.append(row("    successes:", diagnoseCount(Verdict.SUCCESS)));
                    out.append(row("    failures:", diagnoseCount(Verdict.FAILURE)));
                    out.append(row("    warnings:", diagnoseCount(Verdict.WARN)));
                    out.append(row("    unknown:", diagnoseCount(Verdict.UNKNOWN)));
                }
            });
        }

        if (!skipHistogram.isEmpty()) {
            out.append(LINE)
                .append(String.format("%-32s %-4s | %-8s | %-10s | %-11s",
                    "Modules not run due to missing:", "sudo", "software", "parameters", "perf-impact"))
                .append(LINE)
                .append(String.format("%-32s %4d | %8d | %10d | %11d",
                    "",
                    skipped(SkipReason.REQUIRES_SUDO),
                    skipped(SkipReason.MISSING_SOFTWARE),
                    skipped(SkipReason.MISSING_ARGUMENT),
                    skipped(SkipReason.PERFORMANCE_IMPACT)))
                .append(LINE);
        }
        return out.toString();
    }

    private static String row(String label, Object value) {
        return String.format("%-32s %s", label, value) + LINE;
    }

    /**
     * Plain map form for JSON output.
     */
    public Map<String, Object> toSerializableMap() {
        Map<String, Object> verdicts = new LinkedHashMap<>();
        diagnoseVerdicts.forEach((verdict, count) -> verdicts.put(verdict.name().toLowerCase(), count));
        Map<String, Object> skipped = new LinkedHashMap<>();
        skipHistogram.forEach((reason, count) -> skipped.put(reason.name().toLowerCase(), count));
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("totalRun", totalRun);
        map.put("classes", new LinkedHashMap<>(classCounts));
        map.put("diagnose", verdicts);
        map.put("skipped", skipped);
        return map;
    }
}
