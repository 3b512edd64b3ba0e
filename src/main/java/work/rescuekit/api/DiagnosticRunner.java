package work.rescuekit.api;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rescuekit.exec.ModuleExecutor;
import work.rescuekit.exec.RunContext;
import work.rescuekit.exec.WorkerPool;
import work.rescuekit.module.HostEnvironment;
import work.rescuekit.module.Module;
import work.rescuekit.module.ModuleRunFailureException;
import work.rescuekit.module.Verdict;
import work.rescuekit.prune.ArgumentReconciler;
import work.rescuekit.prune.HostFacts;
import work.rescuekit.prune.ModuleSelection;
import work.rescuekit.prune.PruneReport;
import work.rescuekit.prune.PruningPipeline;
import work.rescuekit.prune.SystemHostFacts;
import work.rescuekit.registry.ModuleRegistry;
import work.rescuekit.report.RunSummary;
import work.rescuekit.schedule.BatchScheduler;

/**
 * Public entry point: runs prediagnostics, prunes and schedules the diagnostic modules, runs
 * postdiagnostics and summarizes the outcome. Also backs the catalog commands.
 */
public final class DiagnosticRunner {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticRunner.class);
    private static final DateTimeFormatter RUN_DIR_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;
    private static final String SHARED_FUNCTIONS = "functions.bash";

    private final RunConfiguration configuration;
    private final HostFacts facts;
    private final ModuleExecutor executor;
    private final PrintStream console;

    public DiagnosticRunner(RunConfiguration configuration) {
        this(configuration, new SystemHostFacts(configuration.options()), ModuleExecutor.process(), System.out);
    }

    public DiagnosticRunner(RunConfiguration configuration, HostFacts facts, ModuleExecutor executor, PrintStream console) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.facts = Objects.requireNonNull(facts, "facts");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.console = Objects.requireNonNull(console, "console");
    }

    /**
     * Executes a full run. A failing prediagnostic aborts the run and is reported in the result rather
     * than thrown.
     */
    public RunResult run() {
        var started = Instant.now();
        var runDir = createRunDirectories();
        var context = RunContext.builder()
            .options(configuration.options())
            .environment(hostEnvironment(runDir))
            .timeout(configuration.timeout().orElse(null))
            .logDir(runDir.resolve("mod_out"))
            .console(console)
            .build();

        try {
            runPrediagnostics(context);
        } catch (PrediagnosticFailureException ex) {
            log.error(ex.getMessage());
            return RunResult.aborted(runDir, ex.getMessage(), started);
        }

        var modules = ModuleRegistry.load(configuration.moduleDir());
        var options = configuration.options();
        var selection = ModuleSelection.from(options, modules);
        int rejected = ArgumentReconciler.forModules(modules).reconcile(modules, options);
        log.debug("Argument reconciliation rejected {} module(s)", rejected);
        PruneReport pruneReport = new PruningPipeline(facts).prune(modules, selection);

        modules.sort(Comparator.comparing((Module module) -> module.constraint().first("class")));
        var pool = new WorkerPool(configuration.concurrency(), executor, context);
        try {
            pool.run(BatchScheduler.createBatches(modules.modules()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return RunResult.aborted(runDir, "Interrupted while running modules", started);
        }
        if (context.anyModuleAnnounced()) {
            console.println();
        }

        runPostdiagnostics(context);

        var summary = RunSummary.of(modules, pruneReport);
        var failed = pool.failures().stream().map(Module::name).collect(Collectors.toList());
        return RunResult.completed(runDir, summary, failed, started);
    }

    private Path createRunDirectories() {
        var runDir = configuration.workDir()
            .resolve(RUN_DIR_FORMAT.format(LocalDateTime.now(ZoneOffset.UTC)).replace(':', '_'));
        try {
            Files.createDirectories(runDir.resolve("gathered_out"));
            for (String placement : List.of("prediagnostic", "run", "postdiagnostic")) {
                Files.createDirectories(runDir.resolve("mod_out").resolve(placement));
            }
            Path functions = configuration.modulesRoot().resolve(SHARED_FUNCTIONS);
            if (Files.isRegularFile(functions)) {
                Files.copy(functions, runDir.resolve(SHARED_FUNCTIONS), StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to prepare run directory " + runDir + ": " + ex.getMessage(), ex);
        }
        log.info("Run directory: {}", runDir);
        return runDir;
    }

    HostEnvironment hostEnvironment(Path runDir) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(HostEnvironment.PATH, Optional.ofNullable(System.getenv("PATH")).orElse("/usr/bin:/bin"));
        values.put(HostEnvironment.WORKDIR, configuration.workDir().toString());
        values.put(HostEnvironment.RUNDIR, runDir.toString());
        values.put(HostEnvironment.LOGDIR, runDir.resolve("mod_out").toString());
        values.put(HostEnvironment.GATHEREDDIR, runDir.resolve("gathered_out").toString());
        values.put(HostEnvironment.DISTRO, facts.distro());
        values.put(HostEnvironment.NET_DRIVER, facts.netDriver());
        values.put(HostEnvironment.VIRT_TYPE, facts.virtType());
        values.put(HostEnvironment.SUDO, facts.isRoot() ? "True" : "False");
        values.put(HostEnvironment.PERFIMPACT, facts.perfImpactAllowed() ? "True" : "False");
        values.put(HostEnvironment.CALLPATH, configuration.modulesRoot().toString());
        return HostEnvironment.of(values);
    }

    private void runPrediagnostics(RunContext context) {
        if (!Files.isDirectory(configuration.preDiagnosticDir())) {
            return;
        }
        for (Module module : ModuleRegistry.load(configuration.preDiagnosticDir())) {
            if (!module.isApplicable()) {
                log.info("module {}: Skipping. Reason: {}", module.qualifiedName(), module.whySkipping());
                continue;
            }
            log.info("module {}: Running", module.qualifiedName());
            try {
                context.writeModuleLog(module, executor.execute(module, context));
            } catch (ModuleRunFailureException ex) {
                context.writeModuleLog(module, ex.output());
                throw new PrediagnosticFailureException(module.name(), ex.getMessage(), ex);
            }
            if (module.verdict().orElse(Verdict.UNKNOWN) == Verdict.FAILURE) {
                throw new PrediagnosticFailureException(module.name(), module.summary());
            }
        }
    }

    private void runPostdiagnostics(RunContext context) {
        if (!Files.isDirectory(configuration.postDiagnosticDir())) {
            return;
        }
        for (Module module : ModuleRegistry.load(configuration.postDiagnosticDir())) {
            if (!module.isApplicable()) {
                log.info("module {}: Skipping. Reason: {}", module.qualifiedName(), module.whySkipping());
                continue;
            }
            log.info("module {}: Running", module.qualifiedName());
            try {
                context.writeModuleLog(module, executor.execute(module, context));
            } catch (ModuleRunFailureException ex) {
                context.writeModuleLog(module, ex.output());
                log.warn("module {}: {}", module.qualifiedName(), ex.getMessage());
            }
        }
    }

    /**
     * Catalog of applicable modules within the selected domains and classes.
     */
    public String list() {
        var modules = ModuleRegistry.load(configuration.moduleDir());
        var selection = ModuleSelection.from(configuration.options(), modules);
        var nl = System.lineSeparator();
        var out = new StringBuilder();
        out.append("Here is a list of available modules that apply to the current host:").append(nl).append(nl);
        out.append("  ").append(String.format("%-20.18s%-10.8s%-13.11s%-77.75s", "Module Name", "Class", "Domain", "Description"))
            .append(nl);
        for (Module module : modules) {
            if (module.isApplicable() && selection.includes(module)) {
                out.append(module.listLine().stripTrailing()).append(nl);
            }
        }
        out.append(nl).append(" *Requires sudo/root to run").append(nl);
        out.append(" +Requires --perfimpact to run (can potentially cause performance impact)").append(nl);
        return out.toString();
    }

    /**
     * Help text of the named modules, looked up across all placements. Without names, help for every
     * module matching the selection.
     */
    public String help(List<String> names) {
        var catalog = new ArrayList<Module>();
        for (Path dir : List.of(configuration.preDiagnosticDir(), configuration.moduleDir(), configuration.postDiagnosticDir())) {
            if (Files.isDirectory(dir)) {
                ModuleRegistry.load(dir).forEach(catalog::add);
            }
        }
        var nl = System.lineSeparator();
        var out = new StringBuilder();
        if (names.isEmpty()) {
            var modules = ModuleRegistry.load(configuration.moduleDir());
            var selection = ModuleSelection.from(configuration.options(), modules);
            for (Module module : modules) {
                if (selection.includes(module)) {
                    out.append(module.help()).append(nl).append(nl);
                }
            }
            return out.toString();
        }
        for (String name : names) {
            Optional<Module> match = catalog.stream().filter(module -> module.name().equals(name)).findFirst();
            if (match.isPresent()) {
                out.append(match.get().help()).append(nl).append(nl);
            } else {
                out.append("No module named '").append(name).append("'.").append(nl).append(nl);
            }
        }
        return out.toString();
    }

    /**
     * Reports the packages providing software that some module requires but the host lacks.
     */
    public String softwareCheck() {
        var modules = ModuleRegistry.load(configuration.moduleDir());
        Set<String> needed = new LinkedHashSet<>();
        for (Module module : modules) {
            for (String software : module.constraint().get("software")) {
                if (!facts.isExecutable(software)) {
                    needed.addAll(module.packages());
                }
            }
        }
        var nl = System.lineSeparator();
        if (needed.isEmpty()) {
            return "All test software requirements have been met." + nl;
        }
        var out = new StringBuilder();
        out.append("One or more software packages required to run all modules are missing.").append(nl)
            .append("Information regarding these software packages can be found at the specified URLs below.")
            .append(nl).append(nl);
        var packageIndex = modules.packageIndex();
        for (String pkg : needed) {
            String[] parts = pkg.trim().split("\\s+");
            String affected = packageIndex.getOrDefault(pkg, List.of()).stream()
                .map(Module::name)
                .collect(Collectors.joining(","));
            if (parts.length != 2) {
                throw new IllegalStateException("Unable to parse package '" + pkg + "' used by modules: " + affected);
            }
            out.append("Package-Name: ").append(parts[0]).append(nl);
            out.append("Package-URL: ").append(parts[1]).append(nl);
            out.append("Affected-Modules: ").append(affected).append(nl).append(nl);
        }
        return out.toString();
    }

    public RunConfiguration configuration() {
        return configuration;
    }
}
