package work.rescuekit.schedule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rescuekit.module.Module;

/**
 * Partitions runnable modules into ordered batches that may execute concurrently.
 *
 * <p>Each batch is built greedily from the modules not yet batched, in their original order. A module is
 * admitted when it shares a class with the batch (or the batch is still empty) and none of its
 * {@code parallelexclusive} tags is already held by the batch. Output depends only on input order.</p>
 */
public final class BatchScheduler {
    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private BatchScheduler() {}

    /**
     * @return batches as indices into {@code modules}
     */
    public static List<List<Integer>> createBatchIndices(List<Module> modules) {
        Map<Integer, Module> remaining = new LinkedHashMap<>();
        for (int i = 0; i < modules.size(); i++) {
            remaining.put(i, modules.get(i));
        }

        List<List<Integer>> batches = new ArrayList<>();
        while (!remaining.isEmpty()) {
            log.debug("Building new batch {}, considering {} modules", batches.size(), remaining.size());
            List<Integer> batch = new ArrayList<>();
            Set<String> batchExclusives = new LinkedHashSet<>();
            Set<String> batchClass = null;

            for (Map.Entry<Integer, Module> entry : remaining.entrySet()) {
                Module module = entry.getValue();
                List<String> classes = module.constraint().get("class");
                List<String> exclusives = module.constraint().get("parallelexclusive");

                if (batchClass != null && !intersects(batchClass, classes)) {
                    continue;
                }
                if (intersects(batchExclusives, exclusives)) {
                    continue;
                }
                batch.add(entry.getKey());
                batchExclusives.addAll(exclusives);
                if (batchClass == null) {
                    batchClass = new LinkedHashSet<>();
                }
                batchClass.addAll(classes);
                log.debug("{} added to batch {}; exclusives {} class {}",
                    module.name(), batches.size(), batchExclusives, batchClass);
            }

            batch.forEach(remaining::remove);
            log.debug("built batch, contains {} modules. {} modules remain unclaimed", batch.size(), remaining.size());
            batches.add(List.copyOf(batch));
        }
        return List.copyOf(batches);
    }

    public static List<List<Module>> createBatches(List<Module> modules) {
        List<List<Module>> batches = new ArrayList<>();
        for (List<Integer> indices : createBatchIndices(modules)) {
            List<Module> batch = new ArrayList<>(indices.size());
            for (int index : indices) {
                batch.add(modules.get(index));
            }
            batches.add(List.copyOf(batch));
        }
        return List.copyOf(batches);
    }

    private static boolean intersects(Set<String> held, List<String> candidate) {
        for (String value : candidate) {
            if (held.contains(value)) {
                return true;
            }
        }
        return false;
    }
}
