package work.rescuekit.exec;

import work.rescuekit.module.Module;
import work.rescuekit.module.ModuleRunFailureException;

/**
 * Runs one module on the calling worker thread and returns its captured output.
 */
@FunctionalInterface
public interface ModuleExecutor {
    String execute(Module module, RunContext context) throws ModuleRunFailureException;

    /**
     * Launches the module as a child process with the context's environment and timeout.
     */
    static ModuleExecutor process() {
        return (module, context) -> module.run(context.options(), context.environment(), context.timeout());
    }
}
