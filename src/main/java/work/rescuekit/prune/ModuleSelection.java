package work.rescuekit.prune;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import work.rescuekit.config.RunOptions;
import work.rescuekit.module.Module;
import work.rescuekit.registry.ModuleRegistry;

/**
 * What the user asked to run: explicit module names, or domains and classes.
 *
 * <p>An empty {@code moduleNames} means every module. Domains and classes default to everything present
 * in the registry when the user named none.</p>
 */
public record ModuleSelection(Optional<List<String>> moduleNames, List<String> domains, List<String> classes) {
    public static final String NOT_SPECIFIED = "Not specified to run.";
    public static final String NOT_IN_DOMAIN = "Not in specified domain to run.";
    public static final String NOT_IN_CLASS = "Not in specified class to run.";

    public ModuleSelection {
        moduleNames = moduleNames == null ? Optional.empty() : moduleNames.map(List::copyOf);
        domains = List.copyOf(domains == null ? List.of() : domains);
        classes = List.copyOf(classes == null ? List.of() : classes);
    }

    /**
     * Reads {@code onlymodules}, {@code onlydomains} and {@code onlyclasses} (comma separated) from the
     * global args, falling back to every domain and class of {@code registry}.
     */
    public static ModuleSelection from(RunOptions options, ModuleRegistry registry) {
        Optional<List<String>> names = options.global(RunOptions.ONLY_MODULES).map(ModuleSelection::splitCommas);
        List<String> domains = options.global(RunOptions.ONLY_DOMAINS)
            .map(ModuleSelection::splitCommas)
            .orElseGet(registry::domains);
        List<String> classes = options.global(RunOptions.ONLY_CLASSES)
            .map(ModuleSelection::splitCommas)
            .orElseGet(registry::classes);
        return new ModuleSelection(names, domains, classes);
    }

    static List<String> splitCommas(String value) {
        List<String> result = new ArrayList<>();
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty() && !result.contains(trimmed)) {
                result.add(trimmed);
            }
        }
        return result;
    }

    public boolean includes(Module module) {
        return outOfScopeReason(module).isEmpty();
    }

    /**
     * Why the selection excludes {@code module}, checked by name, then domain, then class.
     */
    public Optional<String> outOfScopeReason(Module module) {
        if (moduleNames.isPresent() && !moduleNames.get().contains(module.name())) {
            return Optional.of(NOT_SPECIFIED);
        }
        if (!intersects(module.constraint().get("domain"), domains)) {
            return Optional.of(NOT_IN_DOMAIN);
        }
        if (!intersects(module.constraint().get("class"), classes)) {
            return Optional.of(NOT_IN_CLASS);
        }
        return Optional.empty();
    }

    private static boolean intersects(Collection<String> left, Collection<String> right) {
        for (String value : left) {
            if (right.contains(value)) {
                return true;
            }
        }
        return false;
    }
}
