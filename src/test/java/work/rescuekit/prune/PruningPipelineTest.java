package work.rescuekit.prune;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.rescuekit.config.RunOptions;
import work.rescuekit.module.Module;
import work.rescuekit.module.SkipReason;
import work.rescuekit.registry.ModuleRegistry;
import work.rescuekit.support.ModuleFixtures;

class PruningPipelineTest {
    private static ModuleSelection everything(ModuleRegistry registry) {
        return ModuleSelection.from(RunOptions.empty(), registry);
    }

    @Test
    void sudoModuleOnNonRootHostIsPruned() {
        var registry = new ModuleRegistry();
        var sudo = ModuleFixtures.module("needsroot").with("sudo", "True").build();
        var plain = ModuleFixtures.module("plain").build();
        registry.append(sudo);
        registry.append(plain);

        var report = new PruningPipeline(ModuleFixtures.facts().root(false)).prune(registry, everything(registry));

        assertEquals(PruningPipeline.REQUIRES_SUDO, sudo.whySkipping());
        assertEquals(1, report.count(SkipReason.REQUIRES_SUDO));
        assertEquals(List.of(sudo), report.pruned());
        assertEquals(List.of(plain), registry.modules());
        assertTrue(plain.isApplicable());
    }

    @Test
    void rootHostKeepsSudoModule() {
        var registry = new ModuleRegistry();
        registry.append(ModuleFixtures.module("needsroot").with("sudo", "True").build());

        var report = new PruningPipeline(ModuleFixtures.facts().root(true)).prune(registry, everything(registry));

        assertEquals(0, report.count(SkipReason.REQUIRES_SUDO));
        assertEquals(1, registry.size());
    }

    @Test
    void eachHostFactProducesItsReason() {
        var registry = new ModuleRegistry();
        registry.append(ModuleFixtures.module("ec2only").with("requires_ec2", "True").build());
        registry.append(ModuleFixtures.module("suseonly").with("distro", "suse").build());
        registry.append(ModuleFixtures.module("heavy").with("perfimpact", "True").build());
        registry.append(ModuleFixtures.module("tracer").with("software", "bpftrace").build());
        registry.append(ModuleFixtures.module("fine").with("software", "ip").build());
        var modules = List.copyOf(registry.modules());
        var facts = ModuleFixtures.facts().instance(false).installed("ip");

        var report = new PruningPipeline(facts).prune(registry, everything(registry));

        assertEquals(PruningPipeline.REQUIRES_INSTANCE, modules.get(0).whySkipping());
        assertEquals(Optional.of(SkipReason.NOT_AN_EC2_INSTANCE), modules.get(0).skipReason());
        assertEquals(PruningPipeline.WRONG_DISTRO, modules.get(1).whySkipping());
        assertEquals(PruningPipeline.REQUIRES_PERF_IMPACT, modules.get(2).whySkipping());
        assertEquals("Requires missing/non-executable software 'bpftrace'.", modules.get(3).whySkipping());
        assertEquals(List.of("fine"), registry.stream().map(Module::name).collect(Collectors.toList()));
        assertEquals(1, report.count(SkipReason.PERFORMANCE_IMPACT));
        assertEquals(1, report.count(SkipReason.MISSING_SOFTWARE));
        assertEquals(0, report.count(SkipReason.NOT_AN_EC2_INSTANCE));
        assertEquals(0, report.count(SkipReason.NOT_APPLICABLE_TO_DISTRO));
    }

    @Test
    void instanceCheckRunsBeforeDistroAndSudo() {
        var module = ModuleFixtures.module("all")
            .with("requires_ec2", "True")
            .with("distro", "suse")
            .with("sudo", "True")
            .build();
        var pipeline = new PruningPipeline(ModuleFixtures.facts().instance(false));

        assertFalse(pipeline.evaluate(module, new ModuleSelection(Optional.empty(), List.of("os"), List.of("diagnose"))));
        assertEquals(Optional.of(SkipReason.NOT_AN_EC2_INSTANCE), module.skipReason());
    }

    @Test
    void perfImpactCheckRunsBeforeSudo() {
        var module = ModuleFixtures.module("both").with("perfimpact", "True").with("sudo", "True").build();
        var pipeline = new PruningPipeline(ModuleFixtures.facts());

        pipeline.evaluate(module, new ModuleSelection(Optional.empty(), List.of("os"), List.of("diagnose")));

        assertEquals(Optional.of(SkipReason.PERFORMANCE_IMPACT), module.skipReason());
    }

    @Test
    void outOfScopeOverridesEarlierReasonAndIsNotCounted() {
        var registry = new ModuleRegistry();
        var module = ModuleFixtures.module("probe").with("class", "collect").build();
        module.markNotApplicable(SkipReason.MISSING_ARGUMENT, "missing required argument 'x'.");
        registry.append(module);
        var selection = new ModuleSelection(Optional.empty(), List.of("os"), List.of("diagnose"));

        var report = new PruningPipeline(ModuleFixtures.facts()).prune(registry, selection);

        assertEquals(ModuleSelection.NOT_IN_CLASS, module.whySkipping());
        assertEquals(0, report.count(SkipReason.MISSING_ARGUMENT));
        assertTrue(registry.isEmpty());
    }

    @Test
    void argumentRejectionIsCountedAsMissingParameter() {
        var registry = new ModuleRegistry();
        var module = ModuleFixtures.module("probe").with("required", "remote_host").build();
        registry.append(module);
        ArgumentReconciler.forModules(registry).reconcile(registry, RunOptions.empty());

        var report = new PruningPipeline(ModuleFixtures.facts()).prune(registry, everything(registry));

        assertEquals(1, report.count(SkipReason.MISSING_ARGUMENT));
        assertTrue(registry.isEmpty());
    }
}
