package work.rescuekit.prune;

import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rescuekit.config.RunOptions;
import work.rescuekit.constraint.Constraint;
import work.rescuekit.module.Module;
import work.rescuekit.module.SkipReason;

/**
 * First applicability phase: checks that every value a module requires is either provided by some
 * module in the catalog or supplied as an argument.
 */
public final class ArgumentReconciler {
    private static final Logger log = LoggerFactory.getLogger(ArgumentReconciler.class);

    /** Axes that every module contributes to the combined catalog constraint. */
    public static final List<String> COMBINED_KEYS = List.of("domain", "class", "distro", "software", "perfimpact");
    /** Axes judged later from host facts instead of arguments. */
    public static final List<String> HOST_FACT_KEYS = List.of("software", "distro", "sudo", "requires_ec2");

    private static final List<String> UNCHECKED_KEYS = List.of("optional", "parallelexclusive");

    private final Constraint combined;

    public ArgumentReconciler(Constraint combined) {
        this.combined = combined;
    }

    /**
     * Union of the {@link #COMBINED_KEYS} axes of every module.
     */
    public static Constraint combinedConstraint(Iterable<Module> modules) {
        Constraint combined = new Constraint();
        for (Module module : modules) {
            combined.update(module.constraint().withKeys(COMBINED_KEYS));
        }
        return combined;
    }

    public static ArgumentReconciler forModules(Iterable<Module> modules) {
        return new ArgumentReconciler(combinedConstraint(modules));
    }

    /**
     * Marks modules with unsatisfied arguments as not applicable. Modules already not applicable keep
     * their earlier reason.
     *
     * @return how many modules this call marked not applicable
     */
    public int reconcile(Iterable<Module> modules, RunOptions options) {
        int rejected = 0;
        for (Module module : modules) {
            if (!module.isApplicable()) {
                continue;
            }
            if ("false".equalsIgnoreCase(options.globalArgs().get(module.name()))) {
                log.debug("module '{}' explicitly excluded with '--no={}'; skipping module", module.name(), module.name());
                module.markNotApplicable(SkipReason.NOT_SELECTED, "explicitly excluded with '--no=" + module.name() + "'.");
                rejected++;
                continue;
            }
            if (!reconcile(module, options)) {
                rejected++;
            }
        }
        return rejected;
    }

    private boolean reconcile(Module module, RunOptions options) {
        Constraint checked = module.constraint().withoutKeys(HOST_FACT_KEYS);
        for (String key : checked.keys()) {
            if (UNCHECKED_KEYS.contains(key)) {
                continue;
            }
            for (String value : checked.get(key)) {
                if (combined.containsValue(key, value)) {
                    continue;
                }
                String problem = missingArgument(module, options, value);
                if (problem != null) {
                    log.debug("module {}: {}", module.qualifiedName(), problem);
                    module.markNotApplicable(SkipReason.MISSING_ARGUMENT, problem);
                    return false;
                }
            }
        }
        return true;
    }

    // Per-module args first, then globals. A present key with an empty value is reported as such.
    private static String missingArgument(Module module, RunOptions options, String name) {
        Map<String, String> own = options.moduleArgs(module.name());
        if (isProvided(own, name) || isProvided(options.globalArgs(), name)) {
            return null;
        }
        if (own.containsKey(name) || options.globalArgs().containsKey(name)) {
            return "missing value for required argument '" + name + "'.";
        }
        return "missing required argument '" + name + "'.";
    }

    private static boolean isProvided(Map<String, String> args, String name) {
        String value = args.get(name);
        return value != null && !value.isEmpty();
    }
}
