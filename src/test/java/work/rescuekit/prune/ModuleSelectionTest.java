package work.rescuekit.prune;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.rescuekit.config.RunOptions;
import work.rescuekit.registry.ModuleRegistry;
import work.rescuekit.support.ModuleFixtures;

class ModuleSelectionTest {
    private static ModuleRegistry registry() {
        var registry = new ModuleRegistry();
        registry.append(ModuleFixtures.module("arpcache").with("domain", "net").with("class", "diagnose").build());
        registry.append(ModuleFixtures.module("aptlog").with("domain", "os").with("class", "gather").build());
        return registry;
    }

    @Test
    void defaultsToEveryDomainAndClass() {
        var selection = ModuleSelection.from(RunOptions.empty(), registry());

        assertEquals(Optional.empty(), selection.moduleNames());
        assertEquals(List.of("net", "os"), selection.domains());
        assertEquals(List.of("diagnose", "gather"), selection.classes());
    }

    @Test
    void readsCommaSeparatedFilters() {
        var options = RunOptions.builder()
            .global(RunOptions.ONLY_MODULES, "arpcache, aptlog,,arpcache")
            .global(RunOptions.ONLY_DOMAINS, "net")
            .global(RunOptions.ONLY_CLASSES, "diagnose,collect")
            .build();

        var selection = ModuleSelection.from(options, registry());

        assertEquals(Optional.of(List.of("arpcache", "aptlog")), selection.moduleNames());
        assertEquals(List.of("net"), selection.domains());
        assertEquals(List.of("diagnose", "collect"), selection.classes());
    }

    @Test
    void reasonsAreCheckedByNameThenDomainThenClass() {
        var module = ModuleFixtures.module("probe").with("domain", "net").with("class", "collect").build();

        var byName = new ModuleSelection(Optional.of(List.of("other")), List.of("os"), List.of("diagnose"));
        var byDomain = new ModuleSelection(Optional.empty(), List.of("os"), List.of("diagnose"));
        var byClass = new ModuleSelection(Optional.empty(), List.of("net"), List.of("diagnose"));
        var included = new ModuleSelection(Optional.of(List.of("probe")), List.of("net"), List.of("collect"));

        assertEquals(Optional.of(ModuleSelection.NOT_SPECIFIED), byName.outOfScopeReason(module));
        assertEquals(Optional.of(ModuleSelection.NOT_IN_DOMAIN), byDomain.outOfScopeReason(module));
        assertEquals(Optional.of(ModuleSelection.NOT_IN_CLASS), byClass.outOfScopeReason(module));
        assertTrue(included.includes(module));
        assertFalse(byClass.includes(module));
    }

    @Test
    void anyOverlappingDomainIsEnough() {
        var module = ModuleFixtures.module("probe").with("domain", "net os").build();
        var selection = new ModuleSelection(Optional.empty(), List.of("os"), List.of("diagnose"));

        assertTrue(selection.includes(module));
    }
}
