package work.rescuekit.prune;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rescuekit.module.Module;
import work.rescuekit.module.SkipReason;
import work.rescuekit.registry.ModuleRegistry;

/**
 * Second applicability phase: applies the user selection and host facts to every module, then removes
 * the modules that will not run from the registry.
 *
 * <p>Inside the selected scope the checks run in a fixed order and the first failing one decides the
 * reason: argument reconciliation, instance requirement, distro, performance impact, sudo. Required
 * software is only looked up when none of those fired.</p>
 */
public final class PruningPipeline {
    private static final Logger log = LoggerFactory.getLogger(PruningPipeline.class);

    public static final String REQUIRES_INSTANCE = "Module requires system be an EC2 instance.";
    public static final String WRONG_DISTRO = "Not applicable to this distro.";
    public static final String REQUIRES_PERF_IMPACT = "Requires performance impact okay, but not given.";
    public static final String REQUIRES_SUDO = "Requires sudo access, but not executing as root.";

    private final HostFacts facts;

    public PruningPipeline(HostFacts facts) {
        this.facts = Objects.requireNonNull(facts, "facts");
    }

    public PruneReport prune(ModuleRegistry registry, ModuleSelection selection) {
        List<Module> pruned = new ArrayList<>();
        for (Module module : registry) {
            if (evaluate(module, selection)) {
                log.info("module {}: Passed prediagnostics validation.", module.qualifiedName());
            } else {
                log.info("module {}: Skipping. Reason: {}", module.qualifiedName(), module.whySkipping());
                pruned.add(module);
            }
        }

        Map<SkipReason, Integer> histogram = new EnumMap<>(SkipReason.class);
        for (Module module : pruned) {
            module.skipReason()
                .filter(SkipReason::tracked)
                .ifPresent(reason -> histogram.merge(reason, 1, Integer::sum));
            registry.remove(module);
        }
        return new PruneReport(pruned, histogram);
    }

    /**
     * @return true when the module stays runnable
     */
    boolean evaluate(Module module, ModuleSelection selection) {
        Optional<String> outOfScope = selection.outOfScopeReason(module);
        if (outOfScope.isPresent()) {
            module.markOutOfScope(outOfScope.get());
            return false;
        }
        if (!module.isApplicable()) {
            return false;
        }
        if (module.requiresInstance() && !facts.isInstance()) {
            module.markNotApplicable(SkipReason.NOT_AN_EC2_INSTANCE, REQUIRES_INSTANCE);
            return false;
        }
        if (!module.constraint().containsValue("distro", facts.distro())) {
            module.markNotApplicable(SkipReason.NOT_APPLICABLE_TO_DISTRO, WRONG_DISTRO);
            return false;
        }
        if (module.requiresPerfImpact() && !facts.perfImpactAllowed()) {
            module.markNotApplicable(SkipReason.PERFORMANCE_IMPACT, REQUIRES_PERF_IMPACT);
            return false;
        }
        if (module.requiresSudo() && !facts.isRoot()) {
            module.markNotApplicable(SkipReason.REQUIRES_SUDO, REQUIRES_SUDO);
            return false;
        }
        for (String software : module.constraint().get("software")) {
            if (!facts.isExecutable(software)) {
                module.markNotApplicable(
                    SkipReason.MISSING_SOFTWARE,
                    "Requires missing/non-executable software '" + software + "'."
                );
                return false;
            }
        }
        return true;
    }
}
