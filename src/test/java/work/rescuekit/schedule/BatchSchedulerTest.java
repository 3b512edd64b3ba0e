package work.rescuekit.schedule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.rescuekit.module.Module;
import work.rescuekit.support.ModuleFixtures;

class BatchSchedulerTest {
    private static Module module(String name, String moduleClass, String exclusive) {
        return ModuleFixtures.module(name).with("class", moduleClass).with("parallelexclusive", exclusive).build();
    }

    private static List<Module> fixture() {
        return List.of(
            module("aptlog", "gather", ""),
            module("arptablesrules", "collect", ""),
            module("arpcache", "diagnose", ""),
            module("arptable", "collect", ""),
            module("bccbiolatency", "collect", "bcc"),
            module("bccbiosnoop", "collect", "bcc")
        );
    }

    @Test
    void groupsByClassAndSeparatesExclusives() {
        assertEquals(
            List.of(List.of(0), List.of(1, 3, 4), List.of(2), List.of(5)),
            BatchScheduler.createBatchIndices(fixture())
        );
    }

    @Test
    void withoutExclusivesSameClassSharesOneBatch() {
        var modules = List.of(module("a", "collect", ""), module("b", "collect", ""), module("c", "collect", ""));

        assertEquals(List.of(List.of(0, 1, 2)), BatchScheduler.createBatchIndices(modules));
    }

    @Test
    void sharedExclusiveForcesOneModulePerBatch() {
        var modules = List.of(module("a", "collect", "bcc"), module("b", "collect", "bcc"), module("c", "collect", "bcc"));

        assertEquals(List.of(List.of(0), List.of(1), List.of(2)), BatchScheduler.createBatchIndices(modules));
    }

    @Test
    void prefixOfFixture() {
        assertEquals(
            List.of(List.of(0), List.of(1, 3), List.of(2)),
            BatchScheduler.createBatchIndices(fixture().subList(0, 4))
        );
    }

    @Test
    void emptyInputHasNoBatches() {
        assertTrue(BatchScheduler.createBatchIndices(List.of()).isEmpty());
    }

    @Test
    void everyModuleAppearsExactlyOnceAndExclusivesNeverShareABatch() {
        var modules = new ArrayList<>(fixture());
        modules.add(module("tcpdump", "collect", "net"));
        modules.add(module("tshark", "collect", "net bcc"));
        modules.add(module("dmesg", "gather", ""));

        var batches = BatchScheduler.createBatches(modules);

        Set<Module> seen = new HashSet<>();
        for (List<Module> batch : batches) {
            Set<String> exclusives = new HashSet<>();
            Set<String> firstClasses = new HashSet<>(batch.get(0).constraint().get("class"));
            for (Module module : batch) {
                assertTrue(seen.add(module), "scheduled twice: " + module);
                for (String exclusive : module.constraint().get("parallelexclusive")) {
                    assertTrue(exclusives.add(exclusive), "exclusive " + exclusive + " shared in " + batch);
                }
                assertFalse(Collections.disjoint(firstClasses, module.constraint().get("class")));
            }
        }
        assertEquals(modules.size(), seen.size());
    }

    @Test
    void schedulingIsDeterministic() {
        assertEquals(BatchScheduler.createBatchIndices(fixture()), BatchScheduler.createBatchIndices(fixture()));
    }

    @Test
    void createBatchesMapsIndicesToModules() {
        var modules = fixture();
        var batches = BatchScheduler.createBatches(modules);

        assertEquals(4, batches.size());
        assertEquals(List.of(modules.get(1), modules.get(3), modules.get(4)), batches.get(1));
    }
}
