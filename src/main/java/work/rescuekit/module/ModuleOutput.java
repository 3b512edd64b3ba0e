package work.rescuekit.module;

import java.util.List;

/**
 * Structured verdict extracted from a module's captured output.
 */
public record ModuleOutput(Verdict verdict, String summary, List<String> details) {
    public ModuleOutput {
        details = details == null ? List.of() : List.copyOf(details);
    }
}
