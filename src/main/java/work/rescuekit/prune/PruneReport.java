package work.rescuekit.prune;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import work.rescuekit.module.Module;
import work.rescuekit.module.SkipReason;

/**
 * Modules removed by a pruning pass together with the histogram of tracked skip reasons.
 */
public record PruneReport(List<Module> pruned, Map<SkipReason, Integer> histogram) {
    public PruneReport {
        pruned = List.copyOf(pruned);
        EnumMap<SkipReason, Integer> copy = new EnumMap<>(SkipReason.class);
        copy.putAll(histogram);
        histogram = Collections.unmodifiableMap(copy);
    }

    public static PruneReport empty() {
        return new PruneReport(List.of(), Map.of());
    }

    public int count(SkipReason reason) {
        return histogram.getOrDefault(reason, 0);
    }
}
